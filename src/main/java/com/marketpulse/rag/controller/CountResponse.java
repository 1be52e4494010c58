package com.marketpulse.rag.controller;

public record CountResponse(int count) {}
