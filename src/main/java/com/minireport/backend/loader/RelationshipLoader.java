package com.minireport.backend.loader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.minireport.backend.source.QueryDescriptor;

/**
 * 关联加载策略：决定每条记录随查询一起预加载哪些关联、遍历多深。
 * <p>
 * 无状态，可被多条流水线并发使用。深度超限一律报错，不做静默截断，
 * 这样声明错误的深层关联会在配置阶段就失败。
 * </p>
 */
public class RelationshipLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelationshipLoader.class);

    /**
     * 按策略把预加载规格挂到查询上。
     *
     * @throws RelationshipDepthException 声明的关联超出 maxDepth
     */
    public QueryDescriptor applyLoadStrategy(QueryDescriptor query, LoadConfig config) {
        if(config == null) {
            return query;
        }
        int maxDepth = config.getMaxDepth();
        LoadSpec spec;
        switch (config.getStrategy()) {
            case EAGER: {
                List<Relationship> all = new ArrayList<>(config.getRequired());
                all.addAll(config.getOptional());
                spec = buildLoadSpec(all, maxDepth);
                LOGGER.debug("Eager loading {} (maxDepth={})", spec, maxDepth);
                break;
            }
            case LAZY:
                // 先校验深度，保证配置错误在任何策略下都能尽早暴露
                buildLoadSpec(config.getRequired(), maxDepth);
                buildLoadSpec(config.getOptional(), maxDepth);
                spec = LoadSpec.empty();
                LOGGER.debug("Lazy loading, nothing preloaded");
                break;
            case SELECTIVE:
                spec = selective(config, maxDepth);
                break;
            default:
                throw new IllegalArgumentException("Unknown load strategy: " + config.getStrategy());
        }
        if(spec.isEmpty()) {
            return query;
        }
        return query.withLoad(query.getLoad().merge(spec));
    }

    /**
     * 构建预加载规格。
     *
     * @throws RelationshipDepthException 任一关联路径的跳数超过 maxDepth
     */
    public LoadSpec buildLoadSpec(List<Relationship> relationships, int maxDepth) {
        LoadSpec spec = toSpec(relationships);
        validateDepth(spec, maxDepth);
        return spec;
    }

    /**
     * 校验规格深度（以关联跳数计）。
     */
    public void validateDepth(LoadSpec spec, int maxDepth) {
        int depth = spec.depth();
        if(depth > maxDepth) {
            throw new RelationshipDepthException(depth, maxDepth);
        }
    }

    /**
     * required 按 maxDepth 完整加载；optional 只在 max(maxDepth - 1, 1) 以内顺带加载，
     * 超出该预算的 optional 整条跳过（仍然受 maxDepth 校验）。
     */
    private LoadSpec selective(LoadConfig config, int maxDepth) {
        LoadSpec required = buildLoadSpec(config.getRequired(), maxDepth);
        int optionalBudget = Math.max(maxDepth - 1, 1);
        List<Relationship> cheap = new ArrayList<>();
        for (Relationship r : config.getOptional()) {
            if(r.depth() > maxDepth) {
                throw new RelationshipDepthException(r.depth(), maxDepth);
            }
            if(r.depth() <= optionalBudget) {
                cheap.add(r);
            } else {
                LOGGER.debug("Skip optional relationship {} (depth {} > {})", r.getName(), r.depth(), optionalBudget);
            }
        }
        LoadSpec spec = required.merge(toSpec(cheap));
        LOGGER.debug("Selective loading {} (maxDepth={})", spec, maxDepth);
        return spec;
    }

    private static LoadSpec toSpec(List<Relationship> relationships) {
        Map<String, LoadSpec> children = new LinkedHashMap<>();
        for (Relationship r : relationships) {
            LoadSpec nested = toSpec(r.getNested());
            children.merge(r.getName(), nested, LoadSpec::merge);
        }
        return LoadSpec.of(children);
    }
}
