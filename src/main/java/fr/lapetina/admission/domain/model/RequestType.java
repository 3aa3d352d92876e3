package fr.lapetina.admission.domain.model;

/**
 * Phase split of a request. Only the aggregated type is valid outside disaggregated serving.
 */
public enum RequestType {
    /** Prefill and decode on the same server */
    CONTEXT_AND_GENERATION,

    /** Prefill only, the KV cache is handed off to a generation server */
    CONTEXT_ONLY,

    /** Decode only, resumes from the context phase parameters of a context server */
    GENERATION_ONLY
}
