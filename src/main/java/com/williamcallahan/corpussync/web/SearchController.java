package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.domain.UnknownCollectionException;
import com.williamcallahan.corpussync.search.SearchBackendUnavailableException;
import com.williamcallahan.corpussync.search.SearchGateway;
import com.williamcallahan.corpussync.search.SearchHit;
import com.williamcallahan.corpussync.search.SearchMode;
import com.williamcallahan.corpussync.search.SearchOutcome;
import com.williamcallahan.corpussync.search.SearchQuery;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ranked search over the indexed collections.
 *
 * <p>A degraded answer is still a 200, flagged with {@value #DEGRADED_HEADER} and explained in
 * {@value #NOTICE_HEADER}. A backend failure that leaves nothing to answer with is a 503, never
 * an empty list.</p>
 */
@RestController
public class SearchController extends BaseController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    static final String DEGRADED_HEADER = "X-Search-Degraded";
    static final String NOTICE_HEADER = "X-Search-Notice";

    private final SearchGateway searchGateway;

    public SearchController(SearchGateway searchGateway, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.searchGateway = searchGateway;
    }

    @PostMapping("/search")
    public ResponseEntity<List<SearchHit>> search(@Valid @RequestBody SearchRequest request) {
        SearchQuery query = new SearchQuery(
                request.query(),
                request.collections(),
                SearchMode.fromWireName(request.mode()),
                request.effectiveLimit(),
                request.audience());
        SearchOutcome outcome = searchGateway.search(query);
        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        if (outcome.degraded()) {
            response.header(DEGRADED_HEADER, "true")
                    .header(NOTICE_HEADER, String.join(" | ", outcome.notices()));
        }
        return response.body(outcome.hits());
    }

    /**
     * An unknown collection in a search body is a malformed request rather than a missing resource.
     */
    @Override
    @ExceptionHandler(UnknownCollectionException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownCollection(UnknownCollectionException unknownCollection) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, unknownCollection.getMessage());
    }

    @ExceptionHandler(SearchBackendUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleBackendUnavailable(SearchBackendUnavailableException unavailable) {
        log.warn("[SEARCH] Answering 503: {}", unavailable.getMessage());
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE, unavailable.getMessage(), String.join("; ", unavailable.failures()));
    }
}
