package com.calibration.dcm.model;

import lombok.Value;

/**
 * Entry of the FUNKTIONEN list. Version and description are null when the FKT line omits them.
 */
@Value
public class DcmFunction {
    String name;
    String version;
    String description;
}
