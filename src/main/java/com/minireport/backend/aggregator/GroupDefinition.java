package com.minireport.backend.aggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * 报表定义层传入的一级分组声明，分组字段尚未解析。
 * <p>
 * expression 对流水线不透明，只交给 {@link FieldResolver} 解释。
 * </p>
 */
public final class GroupDefinition {

    private final String name;
    private final int level;
    private final Object expression;
    private final Set<AggregateFunc> functions;
    private final List<String> valueFields;
    private final SortDirection sortDirection;

    private GroupDefinition(Builder b) {
        this.name = b.name;
        this.level = b.level;
        this.expression = b.expression;
        this.functions = Collections.unmodifiableSet(EnumSet.copyOf(b.functions));
        this.valueFields = Collections.unmodifiableList(new ArrayList<>(b.valueFields));
        this.sortDirection = b.sortDirection;
    }

    public static Builder builder(int level, Object expression) {
        return new Builder(level, expression);
    }

    public String getName() {
        return name;
    }

    public int getLevel() {
        return level;
    }

    public Object getExpression() {
        return expression;
    }

    public Set<AggregateFunc> getFunctions() {
        return functions;
    }

    public List<String> getValueFields() {
        return valueFields;
    }

    public SortDirection getSortDirection() {
        return sortDirection;
    }

    @Override
    public String toString() {
        return "GroupDefinition{name=" + name + ", level=" + level + ", expression=" + expression + "}";
    }

    public static final class Builder {
        private String name;
        private final int level;
        private final Object expression;
        private Set<AggregateFunc> functions = EnumSet.of(AggregateFunc.SUM, AggregateFunc.COUNT);
        private List<String> valueFields = Collections.emptyList();
        private SortDirection sortDirection = SortDirection.ASC;

        private Builder(int level, Object expression) {
            Preconditions.checkArgument(level >= 1, "level must be >= 1, got %s", level);
            this.level = level;
            this.expression = expression;
            this.name = "group_level_" + level;
        }

        public Builder name(String name) {
            this.name = Preconditions.checkNotNull(name);
            return this;
        }

        public Builder functions(AggregateFunc first, AggregateFunc... rest) {
            this.functions = EnumSet.of(first, rest);
            return this;
        }

        public Builder functions(Set<AggregateFunc> functions) {
            Preconditions.checkArgument(!functions.isEmpty(), "functions must not be empty");
            this.functions = EnumSet.copyOf(functions);
            return this;
        }

        public Builder valueFields(List<String> valueFields) {
            this.valueFields = Preconditions.checkNotNull(valueFields);
            return this;
        }

        public Builder valueFields(String... valueFields) {
            return valueFields(List.of(valueFields));
        }

        public Builder sort(SortDirection sortDirection) {
            this.sortDirection = Preconditions.checkNotNull(sortDirection);
            return this;
        }

        public GroupDefinition build() {
            return new GroupDefinition(this);
        }
    }
}
