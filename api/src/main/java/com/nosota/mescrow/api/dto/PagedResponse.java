package com.nosota.mescrow.api.dto;

import java.util.List;

/**
 * One page of a listing together with its pagination metadata.
 *
 * @param data         Records of the current page, at most {@code pageSize} of them
 * @param pageNumber   Zero-based page number
 * @param pageSize     Requested page size
 * @param totalRecords Number of records across all pages
 * @param totalPages   Number of pages
 */
public record PagedResponse<T>(
        List<T> data,
        int pageNumber,
        int pageSize,
        long totalRecords,
        int totalPages
) {

    public static <T> PagedResponse<T> of(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        int totalPages = pageSize == 0 ? 0 : (int) Math.ceil((double) totalRecords / pageSize);
        return new PagedResponse<>(data, pageNumber, pageSize, totalRecords, totalPages);
    }
}
