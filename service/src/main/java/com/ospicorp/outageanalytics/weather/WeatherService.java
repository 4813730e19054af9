package com.ospicorp.outageanalytics.weather;

import com.ospicorp.outageanalytics.config.OutageProperties;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.model.Incident;
import com.ospicorp.outageanalytics.incident.service.IncidentService;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WeatherService {
  private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

  private final IncidentService incidentService;
  private final WeatherCorrelator correlator;
  private final OutageProperties properties;

  public WeatherService(IncidentService incidentService, WeatherCorrelator correlator,
      OutageProperties properties) {
    this.incidentService = incidentService;
    this.correlator = correlator;
    this.properties = properties;
  }

  /** The tag table is read on every call so edits to the file apply without a restart. */
  public List<CorrelatedIncident> correlate(FilterCriteria criteria) {
    DistrictTagTable tags = DistrictTagTable.load(Path.of(properties.getDistrictTagsPath()));
    List<Incident> incidents = incidentService.find(criteria);
    log.debug("Correlating {} incidents against {} district tags", incidents.size(), tags.size());
    return correlator.correlate(incidents, tags);
  }
}
