package com.kidsactivity.ingest.service;

import com.kidsactivity.ingest.config.IngestConfig;
import com.kidsactivity.ingest.entity.Location;
import com.kidsactivity.ingest.enums.FacilityType;
import com.kidsactivity.ingest.model.LocationHint;
import com.kidsactivity.ingest.repository.LocationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocationResolverTest {

    @Mock
    LocationRepository locationRepository;

    private LocationResolver resolver;

    @BeforeEach
    void setUp() {
        IngestConfig config = new IngestConfig();
        config.setLocationMinSubstringLength(6);
        resolver = new LocationResolver(locationRepository, config,
                Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static Location location(long id, String name) {
        return Location.builder().id(id).name(name).normalizedName(name.toLowerCase()).build();
    }

    @Test
    void resolve_blankName_returnsNullWithoutQuerying() {
        assertThat(resolver.resolve(LocationHint.builder().name("  ").build())).isNull();
        assertThat(resolver.resolve(null)).isNull();
        verifyNoInteractions(locationRepository);
    }

    @Test
    void resolve_exactNameAndAddress_winsFirst() {
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc("Delbrook Community Centre", "600 W Queens Rd"))
                .thenReturn(Optional.of(location(3, "Delbrook Community Centre")));

        Long id = resolver.resolve(LocationHint.builder().name(" Delbrook Community Centre ").address("600 W Queens Rd").build());

        assertThat(id).isEqualTo(3L);
        verify(locationRepository, never()).findFirstByNormalizedNameOrderByIdAsc(anyString());
    }

    @Test
    void resolve_normalizedNameMatch_fillsMissingGeocode() {
        Location stored = location(4, "Harry Jerome Community Centre");
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc("Harry Jerome Comm. Center", "")).thenReturn(Optional.empty());
        when(locationRepository.findFirstByNormalizedNameOrderByIdAsc("harry jerome comm centre")).thenReturn(Optional.of(stored));
        when(locationRepository.save(stored)).thenReturn(stored);

        Long id = resolver.resolve(LocationHint.builder().name("Harry Jerome Comm. Center").latitude(49.3).longitude(-123.1).build());

        assertThat(id).isEqualTo(4L);
        assertThat(stored.getLatitude()).isEqualTo(49.3);
        assertThat(stored.getLongitude()).isEqualTo(-123.1);
    }

    @Test
    void resolve_substringMatch_usedWhenLongEnough() {
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc(anyString(), anyString())).thenReturn(Optional.empty());
        when(locationRepository.findFirstByNormalizedNameOrderByIdAsc(anyString())).thenReturn(Optional.empty());
        when(locationRepository.findAllByOrderByIdAsc())
                .thenReturn(List.of(location(5, "Capilano Library"), location(9, "LYNN VALLEY VILLAGE")));

        assertThat(resolver.resolve(LocationHint.builder().name("Lynn Valley Village - Room 2").build())).isEqualTo(9L);
        verify(locationRepository, never()).save(any());
    }

    @Test
    void resolve_shortStoredNameInSubstringMatch_isIgnoredAndVenueCreated() {
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc(anyString(), anyString())).thenReturn(Optional.empty());
        when(locationRepository.findFirstByNormalizedNameOrderByIdAsc(anyString())).thenReturn(Optional.empty());
        when(locationRepository.findAllByOrderByIdAsc()).thenReturn(List.of(location(2, "Gym")));
        when(locationRepository.save(any(Location.class))).thenAnswer(inv -> {
            Location l = inv.getArgument(0);
            l.setId(11L);
            return l;
        });

        Long id = resolver.resolve(LocationHint.builder().name("Mickey McDougall Gym").city("North Vancouver").build());

        assertThat(id).isEqualTo(11L);
        ArgumentCaptor<Location> saved = ArgumentCaptor.forClass(Location.class);
        verify(locationRepository).save(saved.capture());
        assertThat(saved.getValue().getFacilityType()).isEqualTo(FacilityType.GYM);
        assertThat(saved.getValue().getNormalizedName()).isEqualTo("mickey mcdougall gym");
        assertThat(saved.getValue().getCity()).isEqualTo("North Vancouver");
        assertThat(saved.getValue().getAddress()).isEmpty();
    }

    @Test
    void resolve_shortHint_skipsSubstringStep() {
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc(anyString(), anyString())).thenReturn(Optional.empty());
        when(locationRepository.findFirstByNormalizedNameOrderByIdAsc(anyString())).thenReturn(Optional.empty());
        when(locationRepository.save(any(Location.class))).thenAnswer(inv -> {
            Location l = inv.getArgument(0);
            l.setId(12L);
            return l;
        });

        assertThat(resolver.resolve(LocationHint.builder().name("Pool").build())).isEqualTo(12L);
        verify(locationRepository, never()).findAllByOrderByIdAsc();
    }

    @Test
    void resolve_percentAndUnderscoreInName_areMatchedLiterally() {
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc(anyString(), anyString())).thenReturn(Optional.empty());
        when(locationRepository.findFirstByNormalizedNameOrderByIdAsc(anyString())).thenReturn(Optional.empty());
        when(locationRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                location(20, "50 Kids Off Swim Hall"),
                location(21, "Room 1 Studio West")));
        when(locationRepository.save(any(Location.class))).thenAnswer(inv -> {
            Location l = inv.getArgument(0);
            l.setId(l.getName().startsWith("50") ? 30L : 31L);
            return l;
        });

        assertThat(resolver.resolve(LocationHint.builder().name("50% Off Swim Hall").build())).isEqualTo(30L);
        assertThat(resolver.resolve(LocationHint.builder().name("Room_1 Studio").build())).isEqualTo(31L);
    }

    @Test
    void resolve_storedNameWithWildcardCharacters_matchesOnlyItsOwnText() {
        when(locationRepository.findFirstByNameAndAddressOrderByIdAsc(anyString(), anyString())).thenReturn(Optional.empty());
        when(locationRepository.findFirstByNormalizedNameOrderByIdAsc(anyString())).thenReturn(Optional.empty());
        when(locationRepository.findAllByOrderByIdAsc()).thenReturn(List.of(location(22, "Kids_Zone Gym")));

        assertThat(resolver.resolve(LocationHint.builder().name("Kids_Zone Gym - Court B").build())).isEqualTo(22L);
        verify(locationRepository, never()).save(any());
    }
}
