package com.flagship.value_ledger.web;

import com.flagship.value_ledger.ledger.ResultPage;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

@Value
public class PageResponse<T> {
    List<T> items;
    int page;
    int size;
    long total;
    int totalPages;

    public static <S, T> PageResponse<T> from(ResultPage<S> page, Function<? super S, ? extends T> mapper) {
        List<T> items = page.getItems().stream().<T>map(mapper).toList();
        return new PageResponse<>(items, page.getPage(), page.getSize(), page.getTotal(), page.getTotalPages());
    }
}
