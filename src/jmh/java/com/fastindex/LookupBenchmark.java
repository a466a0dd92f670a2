package com.fastindex;

import com.fastindex.query.Filter;
import com.fastindex.query.Retriever;
import com.fastindex.store.DenseIntStore;
import com.fastindex.store.HashStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 查找性能基准测试：稠密存储、哈希存储与线性扫描对比
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class LookupBenchmark {

    public record Person(int id, String name) {
    }

    private static final int RECORD_COUNT = 100_000;

    List<Person> people;
    Retriever<Person, Integer> denseRetriever;
    Retriever<Person, Integer> hashRetriever;
    Retriever<Person, String> nameRetriever;
    int probe;

    @Setup
    public void setup() {
        people = new ArrayList<>(RECORD_COUNT);
        for (int i = 0; i < RECORD_COUNT; i++) {
            people.add(new Person(i, "name-" + (i % 1000)));
        }
        denseRetriever = new Retriever<>(DenseIntStore.build(people, Person::id), people);
        hashRetriever = new Retriever<>(HashStore.build(people, Person::id), people);
        nameRetriever = new Retriever<>(HashStore.build(people, Person::name), people);
        probe = RECORD_COUNT / 2;
    }

    @Benchmark
    public Person denseGet() {
        return denseRetriever.get(probe).iterator().next();
    }

    @Benchmark
    public Person hashGet() {
        return hashRetriever.get(probe).iterator().next();
    }

    @Benchmark
    public Person linearScan() {
        for (Person person : people) {
            if (person.id() == probe) {
                return person;
            }
        }
        return null;
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public int filterOr() {
        return nameRetriever.positions(Filter.eq("name-1").or(Filter.eq("name-2")).or(Filter.eq("name-3"))).size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(LookupBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
