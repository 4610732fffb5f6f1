package com.jreinhal.annotator.store;

/**
 * @param read     distinct records parsed from the file
 * @param imported records actually written to the store
 */
public record ImportSummary(int read, int imported) {
    public int skipped() {
        return read - imported;
    }
}
