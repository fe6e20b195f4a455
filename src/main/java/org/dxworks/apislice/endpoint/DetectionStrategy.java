package org.dxworks.apislice.endpoint;

import org.dxworks.apislice.model.DetectionTier;
import org.dxworks.apislice.model.EndpointRecord;

import java.util.List;
import java.util.Optional;

/**
 * One tier of endpoint detection. Returns empty when the tier does not apply to the file,
 * otherwise the (possibly empty) list of endpoints it found.
 */
public interface DetectionStrategy {

    DetectionTier tier();

    Optional<List<EndpointRecord>> detect(DetectionContext context);
}
