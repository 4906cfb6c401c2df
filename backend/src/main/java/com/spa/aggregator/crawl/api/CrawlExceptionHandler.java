package com.spa.aggregator.crawl.api;

import com.spa.aggregator.crawl.service.ActiveCrawlRunException;
import com.spa.aggregator.crawl.service.CrawlRunNotFoundException;
import com.spa.aggregator.crawl.service.IllegalRunTransitionException;
import com.spa.aggregator.crawl.service.ProductNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return error(HttpStatus.CONFLICT, "active_crawl_run", ex);
  }

  @ExceptionHandler(IllegalRunTransitionException.class)
  public ResponseEntity<Map<String, String>> handleIllegalTransition(IllegalRunTransitionException ex) {
    return error(HttpStatus.CONFLICT, "illegal_transition", ex);
  }

  @ExceptionHandler({CrawlRunNotFoundException.class, ProductNotFoundException.class})
  public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException ex) {
    return error(HttpStatus.NOT_FOUND, "not_found", ex);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex);
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, RuntimeException ex) {
    String message = ex.getMessage() == null ? error : ex.getMessage();
    return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
  }
}
