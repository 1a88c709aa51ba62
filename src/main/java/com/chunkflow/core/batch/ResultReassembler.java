package com.chunkflow.core.batch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Merges per-batch result lists into one sequence ordered by each record's
 * sequence index. Arrival order of the batches is irrelevant; records sharing
 * an index keep their relative input order.
 */
public class ResultReassembler<R> {

    private final SequenceIndexExtractor<R> indexExtractor;

    public ResultReassembler(SequenceIndexExtractor<R> indexExtractor) {
        this.indexExtractor = indexExtractor;
    }

    /**
     * @throws DataContractException if any record lacks a sequence index
     */
    public List<R> reassemble(Collection<? extends List<R>> perBatchResults) {
        var keyed = new ArrayList<Keyed<R>>();
        int position = 0;
        for (List<R> batchResults : perBatchResults) {
            for (R record : batchResults) {
                Integer index = indexExtractor.sequenceIndex(record);
                if (index == null) {
                    throw new DataContractException(
                            "Result record at position " + position + " carries no sequence index: " + record);
                }
                keyed.add(new Keyed<>(index, record));
                position++;
            }
        }
        // List.sort is stable, so equal indexes keep arrival order
        keyed.sort(Comparator.comparingInt(Keyed::index));

        var merged = new ArrayList<R>(keyed.size());
        for (var k : keyed) {
            merged.add(k.record());
        }
        return merged;
    }

    private record Keyed<R>(int index, R record) {}
}
