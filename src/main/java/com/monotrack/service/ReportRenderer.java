package com.monotrack.service;

import com.monotrack.dto.DailyReportResponse;

public interface ReportRenderer {
  String render(DailyReportResponse report);
}
