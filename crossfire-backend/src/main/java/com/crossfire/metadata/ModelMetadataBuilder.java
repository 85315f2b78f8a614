package com.crossfire.metadata;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates model objects and produces an immutable {@link ModelMetadata}.
 *
 * <p>Hidden tables and hidden columns are not exposed as dimensions or attributes. Measures are
 * collected from every table.
 */
public class ModelMetadataBuilder {
    private final String modelName;
    private final Clock clock;

    private final List<ModelMetadata.Dimension> dimensions = new ArrayList<>();
    private final List<ModelMetadata.Attribute> attributes = new ArrayList<>();
    private final List<ModelMetadata.Member> members = new ArrayList<>();
    private final List<ModelMetadata.Measure> measures = new ArrayList<>();

    public ModelMetadataBuilder(String modelName, Clock clock) {
        this.modelName = modelName;
        this.clock = clock;
    }

    public ModelMetadataBuilder importTables(List<ModelTable> tables) {
        for (ModelTable table : tables) {
            if (table.isHidden()) {
                continue;
            }
            int dimensionId = dimensions.size();
            String dimensionCode = bracket(table.getName());
            dimensions.add(new ModelMetadata.Dimension(dimensionId, table.getName(), dimensionCode));

            for (ModelTable.Column column : table.getColumns()) {
                if (column.isHidden()) {
                    continue;
                }
                String code = dimensionCode + "." + bracket(column.getName());
                attributes.add(new ModelMetadata.Attribute(
                        attributes.size(),
                        dimensionId,
                        column.getName(),
                        code,
                        code + ".[All].children",
                        code + ".currentmember.uniquename"));
            }
        }
        return this;
    }

    public ModelMetadataBuilder importMeasures(List<ModelTable> tables) {
        for (ModelTable table : tables) {
            for (String measure : table.getMeasures()) {
                measures.add(new ModelMetadata.Measure(measures.size(), measure, "[Measures]." + bracket(measure)));
            }
        }
        return this;
    }

    /**
     * Adds a member under an already imported attribute.
     *
     * @param attributeId owning attribute id
     * @param name member caption
     * @param codeName unique member name as reported by the server
     * @return member id
     */
    public int addMember(int attributeId, String name, String codeName) {
        if (attributeId < 0 || attributeId >= attributes.size()) {
            throw new IllegalArgumentException("Unknown attribute id: " + attributeId);
        }
        int id = members.size();
        members.add(new ModelMetadata.Member(id, attributeId, name, codeName));
        return id;
    }

    public ModelMetadata build() {
        return new ModelMetadata(
                modelName,
                clock.instant(),
                List.copyOf(dimensions),
                List.copyOf(attributes),
                List.copyOf(members),
                List.copyOf(measures));
    }

    private static String bracket(String name) {
        return "[" + name + "]";
    }
}
