package com.flagship.otp_rental.dto;

import lombok.Value;

import java.util.List;

/**
 * One page of a list endpoint plus the numbers a client needs to page further.
 */
@Value
public class PageResponse<T> {
    List<T> data;
    int pageNumber;
    int pageSize;
    long totalRecords;
    int totalPages;

    public static <T> PageResponse<T> of(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        int totalPages = pageSize > 0 ? (int) Math.ceil((double) totalRecords / pageSize) : 0;
        return new PageResponse<>(data, pageNumber, pageSize, totalRecords, totalPages);
    }
}
