package com.flagship.interunit_recon.matching.extract;

import lombok.Value;

/**
 * An employee named in a narration together with their employee id.
 */
@Value
public class PersonReference {
    String name;
    String id;

    /**
     * Display form used in audit trails: {@code <Name>-ID : <digits>}.
     */
    public String combined() {
        return name + "-ID : " + id;
    }
}
