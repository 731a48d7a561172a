package io.rerankbench.core.client;

/**
 * Status code and fully read body of one HTTP exchange.
 */
public record JsonResponse(int statusCode, String body) {}
