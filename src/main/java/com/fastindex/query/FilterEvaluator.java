package com.fastindex.query;

import com.fastindex.store.KeyLookup;
import com.fastindex.store.PositionList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 过滤表达式求值器，输出递增且无重复的位置列表。
 *
 * 同类运算的连续嵌套（例如链式 or）被展开为一组操作数后迭代归并，
 * 递归深度只随 Or/And 的交替层数增长。
 */
public final class FilterEvaluator {

    private FilterEvaluator() {
        // 工具类，禁止实例化
    }

    public static <K> PositionList evaluate(Filter<K> filter, KeyLookup<K> lookup) {
        if (filter == null || lookup == null) {
            throw new IllegalArgumentException("filter与lookup不能为null");
        }
        return evaluateNode(filter, lookup);
    }

    private static <K> PositionList evaluateNode(Filter<K> node, KeyLookup<K> lookup) {
        if (node instanceof Filter.Eq<K> eq) {
            return lookup.positionsFor(eq.key());
        }
        boolean union = node instanceof Filter.Or;
        List<Filter<K>> operands = flatten(node, union);
        if (union) {
            List<PositionList> lists = new ArrayList<>(operands.size());
            for (Filter<K> operand : operands) {
                PositionList positions = evaluateNode(operand, lookup);
                if (!positions.isEmpty()) {
                    lists.add(positions);
                }
            }
            return unionAll(lists);
        }
        PositionList result = null;
        for (Filter<K> operand : operands) {
            PositionList positions = evaluateNode(operand, lookup);
            result = result == null ? positions : PositionList.intersection(result, positions);
            if (result.isEmpty()) {
                return PositionList.EMPTY;
            }
        }
        return result;
    }

    /**
     * 按轮次两两归并，总代价 O(N log k)，N 为位置总数，k 为列表数。
     */
    private static PositionList unionAll(List<PositionList> lists) {
        if (lists.isEmpty()) {
            return PositionList.EMPTY;
        }
        List<PositionList> level = lists;
        while (level.size() > 1) {
            List<PositionList> next = new ArrayList<>((level.size() + 1) / 2);
            for (int index = 0; index + 1 < level.size(); index += 2) {
                next.add(PositionList.union(level.get(index), level.get(index + 1)));
            }
            if (level.size() % 2 != 0) {
                next.add(level.get(level.size() - 1));
            }
            level = next;
        }
        return level.get(0);
    }

    /**
     * 收集同一运算符下的全部操作数，保持从左到右的顺序。
     */
    private static <K> List<Filter<K>> flatten(Filter<K> root, boolean union) {
        List<Filter<K>> operands = new ArrayList<>();
        Deque<Filter<K>> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Filter<K> current = pending.pop();
            if (union && current instanceof Filter.Or<K> or) {
                pending.push(or.right());
                pending.push(or.left());
            } else if (!union && current instanceof Filter.And<K> and) {
                pending.push(and.right());
                pending.push(and.left());
            } else {
                operands.add(current);
            }
        }
        return operands;
    }
}
