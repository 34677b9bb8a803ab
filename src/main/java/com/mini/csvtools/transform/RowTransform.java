package com.mini.csvtools.transform;

import com.mini.csvtools.schema.Row;

/**
 * 单行转换函数
 * 返回 null 表示有意过滤掉该行；抛出异常则记录为该行的失败
 */
@FunctionalInterface
public interface RowTransform {

    Row apply(Row row) throws Exception;
}
