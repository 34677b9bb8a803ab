package com.mini.csvtools.schema;

import com.mini.csvtools.exception.SchemaConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema 协调器
 * 把多个异构表头合并成统一的列顺序，并把每个源行映射到统一的形状。
 * 所有方法都是纯函数，没有副作用。
 */
public final class SchemaReconciler {
    private static final Logger logger = LoggerFactory.getLogger(SchemaReconciler.class);

    private SchemaReconciler() {
    }

    /**
     * 计算统一 Schema：按输入顺序扫描，列名按首次出现的位置排列
     */
    public static Schema reconcile(List<Schema> schemas) {
        if (schemas == null || schemas.isEmpty()) {
            throw new IllegalArgumentException("At least one schema is required");
        }
        Set<String> union = new LinkedHashSet<>();
        for (Schema schema : schemas) {
            union.addAll(schema.getColumns());
        }
        return new Schema(new ArrayList<>(union));
    }

    /**
     * 创建从源 Schema 到统一 Schema 的投影
     * 源 Schema 的所有列都必须出现在统一 Schema 中，保证不丢数据
     */
    public static Projection projection(Schema source, Schema unified) {
        for (String column : source.getColumns()) {
            if (!unified.contains(column)) {
                throw new IllegalArgumentException(
                        "Column '" + column + "' is missing from the unified schema " + unified.getColumns());
            }
        }
        return Projection.between(source, unified);
    }

    /**
     * 把单行映射到统一 Schema
     */
    public static Row project(Row row, Schema source, Schema unified) {
        return projection(source, unified).project(row);
    }

    /**
     * 根据样本行推断每列的类型
     * 同一文件内数值与文本混杂的列视为 STRING；全为 null 的列不出现在结果中
     */
    public static Map<String, DataType> sampleTypes(Schema schema, Iterable<Row> rows) {
        Map<String, DataType> types = new LinkedHashMap<>();
        Set<String> mixed = new LinkedHashSet<>();
        for (Row row : rows) {
            for (int i = 0; i < schema.size(); i++) {
                DataType type = DataType.of(row.getValue(i));
                if (type == null) {
                    continue;
                }
                String column = schema.getColumn(i);
                DataType current = types.get(column);
                DataType widened = current == null ? type : current.widen(type);
                if (widened == null) {
                    mixed.add(column);
                    widened = DataType.STRING;
                }
                types.put(column, widened);
            }
        }
        if (!mixed.isEmpty()) {
            logger.debug("Columns with mixed value types treated as text: {}", mixed);
        }
        return types;
    }

    /**
     * 合并各输入的列类型
     *
     * @param perInput 每个输入文件的列类型（按输入顺序）
     * @param strict 严格模式下数值与文本冲突抛出 SchemaConflictException，宽松模式下该列转为文本
     * @return 统一后的列类型
     */
    public static Map<String, DataType> reconcileTypes(List<Map<String, DataType>> perInput, boolean strict) {
        Map<String, DataType> unified = new LinkedHashMap<>();
        for (int input = 0; input < perInput.size(); input++) {
            for (Map.Entry<String, DataType> entry : perInput.get(input).entrySet()) {
                String column = entry.getKey();
                DataType current = unified.get(column);
                if (current == null) {
                    unified.put(column, entry.getValue());
                    continue;
                }
                DataType widened = current.widen(entry.getValue());
                if (widened == null) {
                    if (strict) {
                        throw new SchemaConflictException(column, String.format(
                                "Column '%s' is %s in an earlier input but %s in input %d",
                                column, current, entry.getValue(), input));
                    }
                    logger.warn("Column '{}' has conflicting types {} and {}, coercing to text",
                            column, current, entry.getValue());
                    widened = DataType.STRING;
                }
                unified.put(column, widened);
            }
        }
        return unified;
    }
}
