package com.minireport.backend.aggregator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 累积分组：第 k 级的分组键 = 第 1..k 级（成功解析的）字段依次拼接。
 * <p>
 * 解析失败的级别整体丢弃，且不推进已累积的字段列表，后续级别只基于成功解析的字段继续累积。
 * </p>
 */
public final class CumulativeGrouping {

    private static final Logger LOGGER = LoggerFactory.getLogger(CumulativeGrouping.class);

    private CumulativeGrouping() {}

    public static List<AggregationSpec> resolve(List<GroupDefinition> definitions, FieldResolver resolver) {
        List<GroupDefinition> sorted = new ArrayList<>(definitions);
        // 稳定排序：同级别保持声明顺序
        sorted.sort(Comparator.comparingInt(GroupDefinition::getLevel));

        List<String> accumulated = new ArrayList<>();
        List<AggregationSpec> specs = new ArrayList<>(sorted.size());
        for (GroupDefinition def : sorted) {
            String field;
            try {
                field = resolver.resolve(def);
            } catch (FieldResolutionException | RuntimeException e) {
                LOGGER.warn("分组级别 {} ({}) 字段解析失败，已跳过: {}", def.getLevel(), def.getName(), e.getMessage());
                continue;
            }
            if(field == null || field.isEmpty()) {
                LOGGER.warn("分组级别 {} ({}) 未解析出字段，已跳过", def.getLevel(), def.getName());
                continue;
            }
            if(accumulated.contains(field)) {
                LOGGER.warn("Duplicate group field '{}' at level {} ({}), composite key will repeat it",
                        field, def.getLevel(), def.getName());
            }
            accumulated.add(field);
            specs.add(new AggregationSpec(def.getName(), def.getLevel(), accumulated, def.getFunctions(),
                    def.getValueFields(), def.getSortDirection()));
        }
        LOGGER.debug("Resolved {} of {} group levels: {}", specs.size(), definitions.size(), specs);
        return specs;
    }
}
