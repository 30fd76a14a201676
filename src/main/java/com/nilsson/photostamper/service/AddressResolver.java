package com.nilsson.photostamper.service;

import com.nilsson.photostamper.model.GeoCoordinate;
import com.nilsson.photostamper.model.ResolvedAddress;
import com.nilsson.photostamper.model.ResolvedAddress.Outcome;
import com.nilsson.photostamper.service.geocode.GeocodedAddress;
import com.nilsson.photostamper.service.geocode.GeocodingException;
import com.nilsson.photostamper.service.geocode.GeocodingTimeoutException;
import com.nilsson.photostamper.service.geocode.ReverseGeocoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.Optional;

/**
 Turns an optional coordinate into the place name printed under the timestamp.
 * <p>Component priority, first match wins:</p>
 <ol>
 <li>city or town, with province: {@code "{province} {city}"}</li>
 <li>city or town, no province: {@code "{city} {town}"}</li>
 <li>village or suburb: {@code "{village} {suburb}"}</li>
 <li>otherwise the blank placeholder</li>
 </ol>
 * <p>Blank parts are dropped and whitespace is collapsed, so a missing component never
 leaves a double or trailing space. Nothing thrown by the geocoder leaves this class.</p>
 */
public class AddressResolver {

    private static final Logger logger = LoggerFactory.getLogger(AddressResolver.class);

    private final ReverseGeocoder geocoder;

    @Inject
    public AddressResolver(ReverseGeocoder geocoder) {
        this.geocoder = geocoder;
    }

    public ResolvedAddress resolve(Optional<GeoCoordinate> coordinate) {
        if (coordinate == null || coordinate.isEmpty()) {
            return ResolvedAddress.unresolved(Outcome.NO_COORDINATE);
        }

        GeocodedAddress address;
        try {
            address = geocoder.reverse(coordinate.get());
        } catch (GeocodingTimeoutException e) {
            logger.warn("Reverse geocoding timed out for {}", coordinate.get());
            return ResolvedAddress.unresolved(Outcome.TIMED_OUT);
        } catch (GeocodingException e) {
            logger.warn("Reverse geocoding failed for {}: {}", coordinate.get(), e.getMessage());
            return ResolvedAddress.unresolved(Outcome.FAILED);
        } catch (RuntimeException e) {
            logger.error("Unexpected geocoder error for {}", coordinate.get(), e);
            return ResolvedAddress.unresolved(Outcome.FAILED);
        }

        ResolvedAddress resolved = format(address);
        logger.debug("Resolved {} to {}", coordinate.get(), resolved);
        return resolved;
    }

    ResolvedAddress format(GeocodedAddress address) {
        if (address == null || address.isEmpty()) {
            return ResolvedAddress.unresolved(Outcome.NO_MATCH);
        }

        String city = address.getCity();
        String town = address.getTown();

        if (!city.isEmpty() || !town.isEmpty()) {
            if (!address.getProvince().isEmpty()) {
                return ResolvedAddress.resolved(join(address.getProvince(), city));
            }
            return ResolvedAddress.resolved(join(city, town));
        }

        if (!address.getVillage().isEmpty() || !address.getSuburb().isEmpty()) {
            return ResolvedAddress.resolved(join(address.getVillage(), address.getSuburb()));
        }

        return ResolvedAddress.unresolved(Outcome.NO_MATCH);
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(part.trim());
        }
        return sb.toString().replaceAll("\\s+", " ");
    }
}
