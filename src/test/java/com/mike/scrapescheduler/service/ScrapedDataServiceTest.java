package com.mike.scrapescheduler.service;

import com.mike.scrapescheduler.dto.ScrapedDataPage;
import com.mike.scrapescheduler.repository.ScrapedDataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class ScrapedDataServiceTest {

    private ScrapedDataRepository repository;
    private ScrapedDataService service;

    @BeforeEach
    void setUp() {
        repository = mock(ScrapedDataRepository.class);
        service = new ScrapedDataService(repository);
    }

    @Test
    void passes_offset_through_unrounded() {
        when(repository.findLatestByScraperId(1L, 2, 1)).thenReturn(List.of());
        when(repository.countByScraperId(1L)).thenReturn(3L);

        ScrapedDataPage page = service.list(1L, 2, 1);

        verify(repository).findLatestByScraperId(1L, 2, 1);
        assertEquals(3L, page.total());
    }

    @Test
    void without_scraper_lists_everything() {
        when(repository.findLatest(50, 7)).thenReturn(List.of());
        when(repository.count()).thenReturn(9L);

        assertEquals(9L, service.list(null, 50, 7).total());
        verify(repository).findLatest(50, 7);
    }

    @Test
    void rejects_out_of_range_limit_and_negative_offset() {
        assertThrows(ValidationException.class, () -> service.list(1L, 0, 0));
        assertThrows(ValidationException.class, () -> service.list(1L, 1001, 0));
        assertThrows(ValidationException.class, () -> service.list(1L, 10, -1));
        verify(repository, never()).findLatestByScraperId(any(), anyInt(), anyInt());
    }
}
