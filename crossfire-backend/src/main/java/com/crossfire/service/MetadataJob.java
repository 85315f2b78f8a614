package com.crossfire.service;

import com.crossfire.api.ModelMetadataRequest;
import com.crossfire.delivery.ChannelKind;
import com.crossfire.delivery.MetadataMessage;
import com.crossfire.metadata.MetadataSource;
import com.crossfire.metadata.ModelMetadata;
import com.crossfire.metadata.ModelMetadataBuilder;
import com.crossfire.metadata.ModelSchema;
import com.crossfire.query.QueryFingerprint;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.Optional;

/**
 * Reads a model's structure and pushes it to the requesting client on the metadata channel.
 */
public class MetadataJob extends BackgroundJob<ModelMetadataRequest, ModelMetadata> {
    /** Model structure changes rarely; keep it longer than query results. */
    public static final int METADATA_TTL_SECONDS = 1800;

    private final MetadataSource metadataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MetadataJob(MetadataSource metadataSource, ObjectMapper objectMapper, Clock clock, JobOptions<ModelMetadata> options) {
        super(options);
        this.metadataSource = metadataSource;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void process(ModelMetadataRequest request, BackgroundJobParams jobParams) {
        try {
            String cacheKey = jobParams.getUserPrincipalName() + "#" + QueryFingerprint.of(request);
            Optional<ModelMetadata> cachedMetadata = cached(cacheKey);

            ModelMetadata metadata;
            if (cachedMetadata.isPresent()) {
                metadata = cachedMetadata.get();
            } else {
                ModelSchema schema = metadataSource.retrieve(request);
                metadata = new ModelMetadataBuilder(schema.getModelName(), clock)
                        .importTables(schema.getTables())
                        .importMeasures(schema.getTables())
                        .build();
                store(cacheKey, metadata);
            }

            MetadataMessage message = new MetadataMessage(
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metadata),
                    jobParams.getUserSubscriberName());
            deliver(jobParams.getUserSubscriberName(), request.getUniqueClientIdentifier(), ChannelKind.METADATA, message);
        } catch (Exception e) {
            log.error("Metadata job failed: database={}, client_id={}", request.getTargetDatabase(), request.getUniqueClientIdentifier(), e);
            sendFailure(e, request.getServerQualifiedName(), jobParams.getUserSubscriberName(), request.getUniqueClientIdentifier(), request);
        }
    }
}
