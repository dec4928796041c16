package com.minireport.backend.loader;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * 报表定义层声明的一条关联关系，可以继续嵌套下一跳关联。
 */
public final class Relationship {

    private final String name;
    private final List<Relationship> nested;

    private Relationship(String name, List<Relationship> nested) {
        if(name == null || name.isEmpty()) {
            throw new IllegalArgumentException("relationship name must not be empty");
        }
        this.name = name;
        this.nested = ImmutableList.copyOf(nested);
    }

    public static Relationship of(String name) {
        return new Relationship(name, ImmutableList.of());
    }

    public static Relationship of(String name, Relationship... nested) {
        return new Relationship(name, Arrays.asList(nested));
    }

    public static Relationship of(String name, List<Relationship> nested) {
        return new Relationship(name, nested);
    }

    public String getName() {
        return name;
    }

    public List<Relationship> getNested() {
        return nested;
    }

    /** 以本关联为起点的跳数，叶子为 1 */
    public int depth() {
        int max = 0;
        for (Relationship r : nested) {
            max = Math.max(max, r.depth());
        }
        return max + 1;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Relationship)) return false;
        Relationship that = (Relationship) o;
        return name.equals(that.name) && nested.equals(that.nested);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nested);
    }

    @Override
    public String toString() {
        return nested.isEmpty() ? name : name + nested;
    }
}
