package com.fintech.recurringcharges.model;

import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A group of transactions that the density-based clustering step placed together.
 * Transient: it seeds exactly one candidate pattern and is not persisted.
 */
@Value
public class Cluster {

    int label;

    /**
     * Members ordered by date ascending.
     */
    List<Transaction> transactions;

    /**
     * Feature rows of the members, in the same order as {@link #transactions}.
     */
    List<double[]> featureRows;

    public static Cluster of(int label, List<Transaction> members, List<double[]> rows) {
        List<Integer> order = IntStream.range(0, members.size()).boxed()
                .sorted(Comparator.comparing((Integer i) -> members.get(i).getDate())
                        .thenComparing(i -> members.get(i).getId()))
                .collect(Collectors.toList());
        List<Transaction> sortedMembers = order.stream().map(members::get).collect(Collectors.toUnmodifiableList());
        List<double[]> sortedRows = order.stream().map(rows::get).collect(Collectors.toUnmodifiableList());
        return new Cluster(label, sortedMembers, sortedRows);
    }

    public int size() {
        return transactions.size();
    }

    public List<String> getTransactionIds() {
        return transactions.stream().map(Transaction::getId).collect(Collectors.toUnmodifiableList());
    }
}
