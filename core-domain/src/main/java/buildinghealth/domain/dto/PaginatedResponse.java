package buildinghealth.domain.dto;

import java.util.List;

public record PaginatedResponse<T>(
        List<T> content,
        int number,
        int size,
        long totalElements,
        int totalPages,
        boolean last,
        boolean first,
        boolean empty) {
}
