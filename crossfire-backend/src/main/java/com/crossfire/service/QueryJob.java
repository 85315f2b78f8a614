package com.crossfire.service;

import com.crossfire.api.QueryRequest;
import com.crossfire.delivery.ChannelKind;
import com.crossfire.delivery.QueryResultMessage;
import com.crossfire.materializer.ResultMaterializer;
import com.crossfire.query.QueryCompiler;
import com.crossfire.query.QueryFingerprint;

import java.util.Optional;

/**
 * Executes a {@link QueryRequest} and pushes the shaped result to the requesting client.
 *
 * <p>Results are cached per user, fingerprint and output format. Empty results are never cached so
 * that the next request retries the backend.
 */
public class QueryJob extends BackgroundJob<QueryRequest, String> {
    private final QueryCompiler compiler;
    private final QueryExecutor executor;
    private final ResultMaterializer materializer;

    public QueryJob(QueryCompiler compiler, QueryExecutor executor, ResultMaterializer materializer, JobOptions<String> options) {
        super(options);
        this.compiler = compiler;
        this.executor = executor;
        this.materializer = materializer;
    }

    @Override
    public void process(QueryRequest request, BackgroundJobParams jobParams) {
        try {
            String cacheKey = cacheKey(request, jobParams);
            Optional<String> cachedResult = cached(cacheKey);

            String result;
            if (cachedResult.isPresent()) {
                log.debug("Query result served from cache: cache_key={}", cacheKey);
                result = cachedResult.get();
            } else {
                String queryText = compiler.compile(request);
                result = executor.execute(queryText, cursor -> materializer.materialize(cursor, request.getOutputFormat()));
                if (isCacheable(result)) {
                    store(cacheKey, result);
                }
            }

            QueryResultMessage message = QueryResultMessage.builder()
                    .payload(result)
                    .queryMetadata(request.getRequestMetadata())
                    .userSubscriberName(jobParams.getUserSubscriberName())
                    .build();
            deliver(jobParams.getUserSubscriberName(), request.getUniqueClientIdentifier(), ChannelKind.QUERY, message);
        } catch (Exception e) {
            log.error("Query job failed: model={}, client_id={}", request.getModelName(), request.getUniqueClientIdentifier(), e);
            sendFailure(e, request.getServerQualifiedName(), jobParams.getUserSubscriberName(), request.getUniqueClientIdentifier(), request);
        }
    }

    static String cacheKey(QueryRequest request, BackgroundJobParams jobParams) {
        return jobParams.getUserPrincipalName() + "#" + QueryFingerprint.of(request) + "#" + request.getOutputFormat().getCode();
    }

    private static boolean isCacheable(String result) {
        return result != null && !result.isEmpty() && !ResultMaterializer.EMPTY_RESPONSE.equals(result);
    }
}
