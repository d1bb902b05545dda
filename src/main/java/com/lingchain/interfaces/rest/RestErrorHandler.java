package com.lingchain.interfaces.rest;

import com.lingchain.dto.ErrorMessage;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestErrorHandler {

  @ExceptionHandler(MethodArgumentNotValidException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onInvalid(MethodArgumentNotValidException e) {
    String msg =
        e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ErrorMessage.of(msg);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onUnreadable(HttpMessageNotReadableException e) {
    return ErrorMessage.of("Malformed request body");
  }

  @ExceptionHandler(RejectedWordException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onRejected(RejectedWordException e) {
    return ErrorMessage.rejected(e.word(), e.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onBadInput(IllegalArgumentException e) {
    return ErrorMessage.of(e.getMessage());
  }
}
