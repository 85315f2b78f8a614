package com.crossfire.query;

import com.crossfire.api.QueryRequest;

import java.util.List;
import java.util.Objects;

/**
 * Builds MDX text from a {@link QueryRequest}.
 *
 * <p>Output shape:
 * <pre>
 * {custom} select non empty { {values} } on 0[, {slicer} on 1] from ( select {filters} from [{model}] )
 * </pre>
 * Empty sections render as empty text; the subselect is always present.
 */
public final class MdxQueryCompiler {
    static final String LINE_SEPARATOR = "\n";

    private static final String LIST_SEPARATOR = ", ";

    private MdxQueryCompiler() {
    }

    public static String compile(QueryRequest request) {
        List<String> values = Objects.requireNonNull(request.getQueryValues(), "queryValues is required");

        String filterSection = filterSection(request.getQueryFilters());
        String slicerSection = slicerSection(request.getQuerySlices(), request.getDefaultMeasure());
        String valuesSection = String.join(LIST_SEPARATOR, values);
        String customSection = customSection(request.getCustomSets(), request.getCustomMembers());

        String slicerSuffix = slicerSection.isEmpty() ? "" : LIST_SEPARATOR + slicerSection + " on 1";
        return customSection
                + " select non empty { " + valuesSection + " } on 0"
                + slicerSuffix
                + " from ( select " + filterSection + " from [" + request.getModelName() + "] )";
    }

    private static String filterSection(List<String> filters) {
        if (isEmpty(filters)) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int axis = 0; axis < filters.size(); axis++) {
            if (axis > 0) {
                sb.append(LIST_SEPARATOR);
            }
            sb.append(filters.get(axis)).append(" on ").append(axis);
        }
        return sb.toString();
    }

    private static String slicerSection(List<String> slices, String defaultMeasure) {
        if (isEmpty(slices)) {
            return "";
        }
        String tuple = "(" + String.join(LIST_SEPARATOR, slices) + ")";
        if (defaultMeasure == null) {
            return tuple;
        }
        return "nonempty( " + tuple + ", " + defaultMeasure + ")";
    }

    private static String customSection(List<String> customSets, List<String> customMembers) {
        if (isEmpty(customSets) && isEmpty(customMembers)) {
            return "";
        }
        StringBuilder sb = new StringBuilder("with ").append(LINE_SEPARATOR);
        if (!isEmpty(customSets)) {
            for (String set : customSets) {
                sb.append("set ").append(set).append(LINE_SEPARATOR);
            }
        }
        if (!isEmpty(customMembers)) {
            for (String member : customMembers) {
                sb.append("member ").append(member).append(LINE_SEPARATOR);
            }
        }
        return sb.toString();
    }

    private static boolean isEmpty(List<String> items) {
        return items == null || items.isEmpty();
    }
}
