package com.example.pairprog.controller;

import com.example.pairprog.autocomplete.AutocompleteService;
import com.example.pairprog.autocomplete.Suggestion;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/autocomplete")
public class AutocompleteController {

  private final AutocompleteService service;

  public AutocompleteController(AutocompleteService service) {
    this.service = service;
  }

  @PostMapping
  public Suggestion suggest(@Valid @RequestBody AutocompleteRequest req) {
    return service.suggest(req.code, req.cursorPosition, req.language);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorView> invalid(MethodArgumentNotValidException e) {
    String msg = e.getBindingResult().getFieldErrors().stream()
        .map(AutocompleteController::describe)
        .collect(Collectors.joining("; "));
    return ResponseEntity.badRequest().body(new ErrorView(msg));
  }

  static String describe(FieldError fe) {
    return fe.getField() + " " + fe.getDefaultMessage();
  }

  /** POST body */
  public static final class AutocompleteRequest {
    @NotNull
    public String code;

    @NotNull
    @Min(0)
    public Integer cursorPosition;

    public String language = "python";
  }
}
