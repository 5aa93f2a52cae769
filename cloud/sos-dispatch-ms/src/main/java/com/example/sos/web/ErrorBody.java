package com.example.sos.web;

public record ErrorBody(String category, String message) {}
