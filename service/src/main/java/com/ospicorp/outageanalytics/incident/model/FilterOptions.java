package com.ospicorp.outageanalytics.incident.model;

import java.time.LocalDate;
import java.util.List;

public record FilterOptions(List<String> districts, List<String> causes, List<LocalDate> dates) {}
