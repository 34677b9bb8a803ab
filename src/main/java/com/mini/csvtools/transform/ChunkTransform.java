package com.mini.csvtools.transform;

import com.mini.csvtools.exception.TransformException;
import com.mini.csvtools.reader.Chunk;
import com.mini.csvtools.schema.Row;
import com.mini.csvtools.schema.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 块转换函数
 * 在工作线程上执行，不能依赖其他块的结果，也不能修改共享状态
 */
@FunctionalInterface
public interface ChunkTransform {

    /**
     * 转换一个 chunk，抛出异常视为整块失败
     */
    List<Row> apply(Chunk chunk) throws Exception;

    /**
     * 输出 Schema，默认与输入相同
     */
    default Schema outputSchema(Schema input) {
        return input;
    }

    /**
     * 工作线程调用的入口，逐行转换会覆盖它以单独记录每行的失败
     */
    default ChunkOutput transform(Chunk chunk) throws Exception {
        return ChunkOutput.of(apply(chunk));
    }

    /**
     * 把单行函数适配为块转换：某行抛出异常只记录该行失败，不影响同块其他行
     */
    static ChunkTransform perRow(RowTransform function) {
        return perRow(function, UnaryOperator.identity());
    }

    static ChunkTransform perRow(RowTransform function, UnaryOperator<Schema> schemaMapping) {
        return new ChunkTransform() {
            @Override
            public List<Row> apply(Chunk chunk) {
                ChunkOutput output = transform(chunk);
                if (!output.getFailures().isEmpty()) {
                    RowFailure first = output.getFailures().get(0);
                    throw new TransformException(first.getChunkIndex(), first.getRowIndex(), first.getCause());
                }
                return output.getRows();
            }

            @Override
            public Schema outputSchema(Schema input) {
                return schemaMapping.apply(input);
            }

            @Override
            public ChunkOutput transform(Chunk chunk) {
                List<Row> rows = new ArrayList<>(chunk.size());
                List<RowFailure> failures = new ArrayList<>();
                for (int i = 0; i < chunk.size(); i++) {
                    try {
                        Row result = function.apply(chunk.get(i));
                        if (result != null) {
                            rows.add(result);
                        }
                    } catch (Exception e) {
                        failures.add(new RowFailure(chunk.getIndex(), chunk.rowIndexOf(i), e));
                    }
                }
                return new ChunkOutput(rows, failures);
            }
        };
    }
}
