package com.crossfire.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

/**
 * A table of a tabular model as reported by the model server, input to {@link ModelMetadataBuilder}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelTable {
    private String name;
    private boolean hidden;
    @Singular
    private List<Column> columns;
    @Singular
    private List<String> measures;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Column {
        private String name;
        private boolean hidden;
    }
}
