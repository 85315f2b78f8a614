package com.crossfire.query;

import com.crossfire.api.ModelMetadataRequest;
import com.crossfire.api.QueryRequest;
import com.crossfire.util.TextSecurity;

import java.util.List;
import java.util.Objects;

/**
 * Computes the fingerprint of a {@link QueryRequest}: a Base64 SHA-256 digest of its query fields.
 *
 * <p>Client and server identity fields are not part of the digest, so the same query submitted from
 * two connections yields the same fingerprint.
 */
public final class QueryFingerprint {
    private static final String ITEM_SEPARATOR = "#";
    private static final String FIELD_SEPARATOR = ".";

    private QueryFingerprint() {
    }

    /**
     * Computes the request fingerprint.
     *
     * @param request query request
     * @return Base64 digest
     * @throws NullPointerException when {@code queryValues} is missing
     */
    public static String of(QueryRequest request) {
        return TextSecurity.computeHashString(canonicalForm(request));
    }

    /**
     * Computes the fingerprint of a metadata request from its target coordinates and client metadata.
     *
     * @param request metadata request
     * @return Base64 digest
     */
    public static String of(ModelMetadataRequest request) {
        return TextSecurity.computeHashString(String.join(FIELD_SEPARATOR,
                Objects.toString(request.getResourceGroup(), ""),
                Objects.toString(request.getRegion(), ""),
                Objects.toString(request.getTargetServer(), ""),
                Objects.toString(request.getTargetDatabase(), ""),
                Objects.toString(request.getRequestMetadata(), "")));
    }

    static String canonicalForm(QueryRequest request) {
        List<String> values = Objects.requireNonNull(request.getQueryValues(), "queryValues is required");

        return String.join(FIELD_SEPARATOR,
                join(request.getQueryFilters()),
                join(request.getQuerySlices()),
                String.join(ITEM_SEPARATOR, values),
                join(request.getCustomMembers()),
                join(request.getCustomSets()),
                Objects.toString(request.getModelName(), ""),
                String.valueOf(request.getCompilationTarget()),
                String.valueOf(request.getOutputFormat().getCode()),
                Objects.toString(request.getDefaultMeasure(), ""));
    }

    private static String join(List<String> items) {
        return items == null ? "" : String.join(ITEM_SEPARATOR, items);
    }
}
