package com.kiwi.container;

import com.kiwi.Constants;
import lombok.Value;

/**
 * The prelude of a container file and the version word that follows it.
 */
@Value
public class ContainerHeader {
    String prelude;
    int version;

    public boolean isFigKiwi() {
        return prelude.startsWith(Constants.FIG_KIWI_MAGIC);
    }

    public boolean isFigJam() {
        return Constants.FIG_JAM_MAGIC.equals(prelude);
    }

    /**
     * True for the {@code fig-kiwie} variant, whose prelude carries one extra byte.
     */
    public boolean isExtended() {
        return Constants.FIG_KIWIE_MAGIC.equals(prelude);
    }
}
