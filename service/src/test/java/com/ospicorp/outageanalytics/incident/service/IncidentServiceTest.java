package com.ospicorp.outageanalytics.incident.service;

import static com.ospicorp.outageanalytics.IncidentFixtures.lasting;
import static com.ospicorp.outageanalytics.IncidentFixtures.local;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ospicorp.outageanalytics.IncidentFixtures;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.model.Incident;
import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import com.ospicorp.outageanalytics.incident.query.QueryBuilder;
import com.ospicorp.outageanalytics.incident.repository.IncidentRepository;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class IncidentServiceTest {

  @Test
  void listingIsNewestFirstWithUnreadableStartsLast() {
    TimeNormalizer normalizer = new TimeNormalizer(IncidentFixtures.ZONE);
    IncidentRepository repository = mock(IncidentRepository.class);
    IncidentService service =
        new IncidentService(new QueryBuilder("incidencias", normalizer), repository);

    Incident older = lasting(local(2024, 1, 9, 8, 0), 30, VoltageLevel.BT);
    Incident unreadable = lasting(
        normalizer.toLocal(TimeNormalizer.SENTINEL), 30, VoltageLevel.MT);
    Incident newer = lasting(local(2024, 1, 10, 8, 0), 30, VoltageLevel.BT);
    when(repository.fetch(any())).thenReturn(List.of(older, unreadable, newer));

    assertThat(service.find(FilterCriteria.none())).containsExactly(newer, older, unreadable);
  }
}
