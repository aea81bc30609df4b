package com.example.pairprog.controller;

/** Compact error body shared by the REST endpoints. */
public final class ErrorView {
  public boolean ok = false;
  public String message;

  public ErrorView(String message) {
    this.message = (message == null ? "Internal error" : message);
  }
}
