package tutoring.analytics.global.error;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.dto.ErrorResponse;
import tutoring.analytics.error.exception.base.BaseException;
import tutoring.analytics.error.exception.base.ServerBaseException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** 비즈니스 예외: 예외에 담긴 동적 메시지(어떤 키/패턴이 잘못되었는지)를 그대로 전달 */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    } else {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(ErrorResponse.from(e));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    MissingServletRequestParameterException.class
  })
  protected ResponseEntity<ErrorResponse> handleValidation(Exception e) {
    log.warn("Validation Failure: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.from(CommonErrorCode.INVALID_INPUT_VALUE, summarize(e)));
  }

  /** 예측하지 못한 시스템 예외: 상세 메시지는 숨기고 공통 코드만 반환 */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ResponseEntity.internalServerError()
        .body(ErrorResponse.from(CommonErrorCode.INTERNAL_SERVER_ERROR, "unexpected error"));
  }

  private static String summarize(Exception e) {
    if (e instanceof MethodArgumentNotValidException invalid
        && invalid.getBindingResult().getFieldError() != null) {
      var fieldError = invalid.getBindingResult().getFieldError();
      return fieldError.getField() + " " + fieldError.getDefaultMessage();
    }
    return e.getMessage();
  }
}
