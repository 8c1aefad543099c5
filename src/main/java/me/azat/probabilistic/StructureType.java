package me.azat.probabilistic;

public enum StructureType {
    BLOOM_FILTER,
    HYPERLOGLOG,
    COUNT_MIN_SKETCH,
    CUCKOO_FILTER,
    MINHASH,
    TOP_K,
    EXACT_COUNTER
}
