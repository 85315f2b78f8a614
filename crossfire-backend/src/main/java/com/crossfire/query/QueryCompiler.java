package com.crossfire.query;

import com.crossfire.api.QueryRequest;
import org.springframework.stereotype.Component;

/**
 * Converts a {@link QueryRequest} into query text for its compilation target.
 */
@Component
public class QueryCompiler {

    /**
     * Compile a request.
     *
     * @param request query request
     * @return query text
     * @throws UnsupportedCompilationTargetException for targets other than MDX
     */
    public String compile(QueryRequest request) {
        switch (request.getCompilationTarget()) {
            case MDX:
                return MdxQueryCompiler.compile(request);
            default:
                throw new UnsupportedCompilationTargetException(request.getCompilationTarget());
        }
    }
}
