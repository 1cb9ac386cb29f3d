package com.monotrack.service;

import com.monotrack.dto.EarnUsage;
import com.monotrack.dto.ReportTotals;
import com.monotrack.dto.SpendCoverage;
import java.util.List;

public record CoverageResult(List<SpendCoverage> spends, List<EarnUsage> earns, ReportTotals totals) {}
