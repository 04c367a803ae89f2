package com.flagship.value_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of a newest-first listing. Pages are 1-based.
 */
@Value
public class ResultPage<T> {
    List<T> items;
    int page;
    int size;
    long total;

    public int getTotalPages() {
        return size == 0 ? 0 : (int) ((total + size - 1) / size);
    }
}
