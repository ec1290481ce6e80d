package com.flamingo.ai.literatureingest.retry;

import com.flamingo.ai.literatureingest.domain.enums.FailureCategory;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.exception.LiteratureApiException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;

/**
 * Decides whether a failed HTTP call to the bibliographic source is worth retrying.
 *
 * <p>Rate-limit (429) and server (5xx) responses, timeouts and connection failures are transient.
 * Any other error response is permanent. The cause chain is walked, so wrapped reactor and client
 * exceptions are recognised too.
 */
@Slf4j
public final class TransientErrorPredicate implements Predicate<Throwable> {

  public static final TransientErrorPredicate INSTANCE = new TransientErrorPredicate();

  private static final Pattern TRANSIENT_MESSAGE_PATTERN =
      Pattern.compile(
          "(?i)("
              + "connection\\s+(refused|reset|closed|timed\\s*out|lost|terminated|broken)"
              + "|connection\\s+prematurely\\s+closed"
              + "|unable\\s+to\\s+connect"
              + "|network\\s+(is\\s+unreachable|error|timeout)"
              + "|socket\\s+(timeout|closed|reset|error)"
              + "|read\\s+timed\\s*out"
              + "|connect\\s+timed\\s*out"
              + "|did\\s+not\\s+observe\\s+any\\s+item\\s+or\\s+terminal\\s+signal"
              + "|temporarily\\s+unavailable"
              + "|try\\s+(again|later)"
              + ")");

  private TransientErrorPredicate() {}

  @Override
  public boolean test(Throwable throwable) {
    Throwable current = throwable;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof FatalIngestionException
          || current instanceof IngestionInterruptedException) {
        return false;
      }
      if (current instanceof LiteratureApiException apiException) {
        return apiException.isRetryable();
      }
      if (current instanceof TimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof ConnectException
          || current instanceof UnknownHostException
          || current instanceof WebClientRequestException) {
        return true;
      }
      if (current instanceof IOException && isTransientByMessage(current.getMessage())) {
        return true;
      }
      if (isTransientByMessage(current.getMessage())) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  /**
   * Maps a failure to the error taxonomy. Anything that is neither fatal nor transient is treated
   * as a permanent failure of the record at hand.
   */
  public static FailureCategory categorize(Throwable throwable) {
    Throwable current = throwable;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof FatalIngestionException) {
        return FailureCategory.FATAL;
      }
      if (current instanceof LiteratureApiException apiException && apiException.isRateLimited()) {
        return FailureCategory.RATE_LIMIT;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return INSTANCE.test(throwable)
        ? FailureCategory.TRANSIENT_NETWORK
        : FailureCategory.PERMANENT_RECORD;
  }

  private static boolean isTransientByMessage(String message) {
    if (message == null || message.isEmpty()) {
      return false;
    }
    if (TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
      log.debug(
          "Transient error detected by message pattern: {}",
          message.length() > 100 ? message.substring(0, 100) + "..." : message);
      return true;
    }
    return false;
  }
}
