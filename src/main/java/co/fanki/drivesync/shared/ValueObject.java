package co.fanki.drivesync.shared;

import java.io.Serializable;

/**
 * Marker interface for immutable values compared by their attributes.
 *
 * <p>Implementations validate themselves on construction, so an instance
 * that exists is always a legal value (an editor identity with a name, a
 * glob with a pattern).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
