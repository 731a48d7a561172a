package io.rerankbench.core.client;

/**
 * One document's score, aligned to the input document list.
 *
 * @param index    position of the document in the input list
 * @param score    relevance score
 * @param document document text
 */
public record RerankItem(int index, double score, String document) {}
