package com.monotrack.controller;

import com.monotrack.dto.DailyReportResponse;
import com.monotrack.service.DailyReportService;
import jakarta.validation.constraints.Pattern;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/api/users/{userId}/reports")
public class ReportController {
  private final DailyReportService dailyReportService;

  public ReportController(DailyReportService dailyReportService) {
    this.dailyReportService = dailyReportService;
  }

  @GetMapping("/daily")
  public DailyReportResponse daily(
      @PathVariable String userId,
      @RequestParam(value = "date", required = false)
      @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "date must be YYYY-MM-DD") String date,
      @RequestParam(value = "tz", required = false) String timezone,
      @RequestParam(value = "render", defaultValue = "true") boolean render) {
    return dailyReportService.dailyReport(userId, date, timezone, render);
  }
}
