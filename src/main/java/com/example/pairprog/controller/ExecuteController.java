package com.example.pairprog.controller;

import com.example.pairprog.execution.ExecutionResult;
import com.example.pairprog.execution.ExecutionService;
import com.example.pairprog.execution.UnsupportedLanguageException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/execute")
public class ExecuteController {

  private static final Logger log = LoggerFactory.getLogger(ExecuteController.class);

  private final ExecutionService service;

  public ExecuteController(ExecutionService service) {
    this.service = service;
  }

  @PostMapping
  public ExecutionResult execute(@Valid @RequestBody ExecuteRequest req) {
    ExecutionResult r = service.execute(req.code, req.language);
    log.info("EXECUTE language={} time={}s error={}", req.language, r.executionTime(), r.error() != null);
    return r;
  }

  @ExceptionHandler(UnsupportedLanguageException.class)
  public ResponseEntity<ErrorView> unsupported(UnsupportedLanguageException e) {
    return ResponseEntity.badRequest().body(new ErrorView(e.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorView> invalid(MethodArgumentNotValidException e) {
    String msg = e.getBindingResult().getFieldErrors().stream()
        .map(AutocompleteController::describe)
        .collect(Collectors.joining("; "));
    return ResponseEntity.badRequest().body(new ErrorView(msg));
  }

  /** POST body */
  public static final class ExecuteRequest {
    @NotNull
    public String code;

    @NotNull
    public String language;
  }
}
