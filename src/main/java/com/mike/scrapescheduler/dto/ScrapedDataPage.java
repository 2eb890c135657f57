package com.mike.scrapescheduler.dto;

import com.mike.scrapescheduler.entity.ScrapedData;

import java.util.List;

public record ScrapedDataPage(List<ScrapedData> data, long total) {
}
