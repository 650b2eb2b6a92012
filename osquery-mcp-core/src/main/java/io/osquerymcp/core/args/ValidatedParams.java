package io.osquerymcp.core.args;

import java.util.List;

/**
 * Parameter records with constraints beyond field presence and type implement this
 * to report them after binding.
 */
public interface ValidatedParams {

    /**
     * @return Constraint violations, empty if the parameters are valid
     */
    List<ValidationError> validate();
}
