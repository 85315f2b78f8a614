package com.crossfire.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * A request to execute a query against a tabular OLAP model.
 *
 * <p>Query fields ({@code queryFilters} through {@code outputFormat}) define what is computed and
 * take part in the request fingerprint. The remaining fields identify the client and the target
 * server and are ignored by the fingerprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    private List<String> queryFilters;
    private List<String> querySlices;
    private List<String> queryValues;
    private List<String> customSets;
    private List<String> customMembers;
    private String defaultMeasure;
    private String modelName;
    @Builder.Default
    private CompilationTarget compilationTarget = CompilationTarget.MDX;
    @Builder.Default
    private OutputFormat outputFormat = OutputFormat.TABLE;

    private String uniqueClientIdentifier;
    private String region;
    private String targetDatabase;
    private String targetServer;
    private String resourceGroup;
    private String jobExecutorSha;
    private String requestMetadata;

    /**
     * Fully qualified server name: region, resource group and server, lower-cased.
     *
     * @return qualified name, or null when no target server is set
     */
    @JsonIgnore
    public String getServerQualifiedName() {
        if (targetServer == null) {
            return null;
        }
        return (region + "." + resourceGroup + "." + targetServer).toLowerCase(Locale.ROOT);
    }
}
