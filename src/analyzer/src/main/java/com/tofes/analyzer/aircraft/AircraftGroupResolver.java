package com.tofes.analyzer.aircraft;

import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Default {@link AircraftGroupLookup}.
 *
 * <p>Sources, in order: the optional reference DB, the built-in type table, then a heuristic
 * over the logged engine and class metadata. Anything left is {@link AircraftGroup#UNRESOLVED}.
 */
@Component
public class AircraftGroupResolver implements AircraftGroupLookup {
  private final Optional<AircraftGroupRepository> repository;

  public AircraftGroupResolver(Optional<AircraftGroupRepository> repository) {
    this.repository = repository;
  }

  @Override
  public AircraftProfile lookup(String aircraftType, String engineType, String aircraftClass) {
    String typeCode = AircraftTypes.normalize(aircraftType);
    Optional<AircraftProfile> known = repository.flatMap(repo -> repo.findByTypeCode(typeCode))
        .or(() -> AircraftTypes.builtIn(typeCode));
    if (known.isPresent()) {
      return new AircraftProfile(typeCode, known.get().group(), known.get().complex());
    }
    return fromMetadata(engineType, aircraftClass)
        .map(group -> new AircraftProfile(typeCode, group, false))
        .orElseGet(() -> AircraftProfile.unresolved(typeCode));
  }

  static Optional<AircraftGroup> fromMetadata(String engineType, String aircraftClass) {
    String engine = lower(engineType);
    String cls = lower(aircraftClass);
    boolean turbine = engine.contains("jet") || engine.contains("turbo") || engine.contains("turbine");
    boolean multi = cls.contains("multi") || cls.contains("mel") || cls.contains("mes");
    boolean single = !multi && (cls.contains("single") || cls.contains("sel") || cls.contains("ses"));

    if (multi) {
      return Optional.of(turbine ? AircraftGroup.C : AircraftGroup.B);
    }
    if (single) {
      return Optional.of(turbine ? AircraftGroup.D : AircraftGroup.A);
    }
    if (engine.contains("jet")) {
      return Optional.of(AircraftGroup.C);
    }
    return Optional.empty();
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
