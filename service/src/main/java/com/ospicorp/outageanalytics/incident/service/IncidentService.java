package com.ospicorp.outageanalytics.incident.service;

import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.model.FilterOptions;
import com.ospicorp.outageanalytics.incident.model.Incident;
import com.ospicorp.outageanalytics.incident.query.QueryBuilder;
import com.ospicorp.outageanalytics.incident.query.QuerySpec;
import com.ospicorp.outageanalytics.incident.repository.IncidentRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IncidentService {
  private static final Logger log = LoggerFactory.getLogger(IncidentService.class);
  private static final Comparator<Incident> NEWEST_FIRST =
      Comparator.comparing((Incident i) -> i.start().toInstant()).reversed();

  private final QueryBuilder queryBuilder;
  private final IncidentRepository repository;

  public IncidentService(QueryBuilder queryBuilder, IncidentRepository repository) {
    this.queryBuilder = queryBuilder;
    this.repository = repository;
  }

  /** Incidents matching {@code criteria}, newest start first. */
  public List<Incident> find(FilterCriteria criteria) {
    QuerySpec spec = queryBuilder.build(criteria);
    List<Incident> incidents = new ArrayList<>(repository.fetch(spec));
    incidents.sort(NEWEST_FIRST);
    log.debug("Fetched {} incidents for {} (window {} - {})", incidents.size(), criteria,
        spec.start(), spec.stop());
    return incidents;
  }

  public FilterOptions filterOptions() {
    return new FilterOptions(repository.listDistricts(), repository.listCauses(),
        repository.listAvailableDates());
  }
}
