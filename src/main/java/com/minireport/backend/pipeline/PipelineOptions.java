package com.minireport.backend.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.minireport.backend.aggregator.AggregateFunc;
import com.minireport.backend.aggregator.FieldResolver;
import com.minireport.backend.aggregator.GroupDefinition;
import com.minireport.backend.source.DataSource;
import com.minireport.backend.source.QueryDescriptor;
import com.minireport.common.Error;
import com.minireport.common.Record;

/**
 * startPipeline 的参数。
 */
public final class PipelineOptions {

    private final DataSource dataSource;
    private final QueryDescriptor query;
    private final List<GroupDefinition> groups;
    private final FieldResolver fieldResolver;
    private final Set<AggregateFunc> globalFunctions;
    private final List<String> globalFields;
    private final Function<Record, Record> transformer;
    private final String reportName;
    private final Map<String, Object> metadata;
    private final PipelineConfig config;

    private PipelineOptions(Builder b) {
        this.dataSource = b.dataSource;
        this.query = b.query;
        this.groups = Collections.unmodifiableList(new ArrayList<>(b.groups));
        this.fieldResolver = b.fieldResolver;
        this.globalFunctions = Collections.unmodifiableSet(b.globalFunctions.isEmpty()
                ? EnumSet.noneOf(AggregateFunc.class) : EnumSet.copyOf(b.globalFunctions));
        this.globalFields = Collections.unmodifiableList(new ArrayList<>(b.globalFields));
        this.transformer = b.transformer;
        this.reportName = b.reportName;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.config = b.config;
    }

    public static Builder builder(DataSource dataSource, QueryDescriptor query) {
        return new Builder(dataSource, query);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public QueryDescriptor getQuery() {
        return query;
    }

    public List<GroupDefinition> getGroups() {
        return groups;
    }

    public FieldResolver getFieldResolver() {
        return fieldResolver;
    }

    public Set<AggregateFunc> getGlobalFunctions() {
        return globalFunctions;
    }

    public List<String> getGlobalFields() {
        return globalFields;
    }

    /** 可能为 null */
    public Function<Record, Record> getTransformer() {
        return transformer;
    }

    public String getReportName() {
        return reportName;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public static final class Builder {
        private final DataSource dataSource;
        private final QueryDescriptor query;
        private List<GroupDefinition> groups = Collections.emptyList();
        private FieldResolver fieldResolver = FieldResolver.fieldNames();
        private Set<AggregateFunc> globalFunctions = Collections.emptySet();
        private List<String> globalFields = Collections.emptyList();
        private Function<Record, Record> transformer;
        private String reportName;
        private Map<String, Object> metadata = Collections.emptyMap();
        private PipelineConfig config = PipelineConfig.defaults();

        private Builder(DataSource dataSource, QueryDescriptor query) {
            if(dataSource == null) {
                throw Error.MissingDataSourceException;
            }
            if(query == null) {
                throw Error.MissingQueryException;
            }
            this.dataSource = dataSource;
            this.query = query;
        }

        public Builder groups(List<GroupDefinition> groups) {
            this.groups = Preconditions.checkNotNull(groups);
            return this;
        }

        public Builder fieldResolver(FieldResolver fieldResolver) {
            this.fieldResolver = Preconditions.checkNotNull(fieldResolver);
            return this;
        }

        /**
         * 全局（不分组）聚合；fields 为空表示所有数值字段。
         */
        public Builder globalAggregations(Set<AggregateFunc> functions, List<String> fields) {
            this.globalFunctions = Preconditions.checkNotNull(functions);
            this.globalFields = Preconditions.checkNotNull(fields);
            return this;
        }

        /**
         * 记录归一化函数，返回 null 表示过滤掉该记录。
         */
        public Builder transformer(Function<Record, Record> transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder reportName(String reportName) {
            this.reportName = reportName;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = Preconditions.checkNotNull(metadata);
            return this;
        }

        public Builder config(PipelineConfig config) {
            this.config = Preconditions.checkNotNull(config);
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
