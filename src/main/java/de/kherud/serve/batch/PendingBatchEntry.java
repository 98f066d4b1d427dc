package de.kherud.serve.batch;

/**
 * One prompt admitted into a dynamic batch window.
 *
 * @param requestIndex position of the submitting caller within the window; results are scattered back by it
 * @param prompt the caller's prompt
 * @param batchKey the caller's generation options
 */
public record PendingBatchEntry(int requestIndex, String prompt, BatchKey batchKey) {
}
