package com.crossfire.metadata;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only description of a model: dimensions, their attributes and members, and measures.
 *
 * <p>Objects are stored in flat lists and refer to their parent by index, so the graph serializes
 * without cycles. An object's {@code id} is its index in its own list.
 */
@Value
public class ModelMetadata {
    String modelName;
    Instant lastUpdated;
    List<Dimension> dimensions;
    List<Attribute> attributes;
    List<Member> members;
    List<Measure> measures;

    @Value
    public static class Dimension {
        int id;
        String name;
        String codeName;
    }

    @Value
    public static class Attribute {
        int id;
        int dimensionId;
        String name;
        String codeName;
        String allMembersCodeName;
        String uniqueMemberCodeName;
    }

    @Value
    public static class Member {
        int id;
        int attributeId;
        String name;
        String codeName;
    }

    @Value
    public static class Measure {
        int id;
        String name;
        String codeName;
    }

    public List<Attribute> attributesOf(int dimensionId) {
        return attributes.stream()
                .filter(a -> a.getDimensionId() == dimensionId)
                .collect(Collectors.toList());
    }

    public List<Member> membersOf(int attributeId) {
        return members.stream()
                .filter(m -> m.getAttributeId() == attributeId)
                .collect(Collectors.toList());
    }

    public Dimension parentOf(Attribute attribute) {
        return dimensions.get(attribute.getDimensionId());
    }

    public Attribute parentOf(Member member) {
        return attributes.get(member.getAttributeId());
    }
}
