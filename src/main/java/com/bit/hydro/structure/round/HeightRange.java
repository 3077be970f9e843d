package com.bit.hydro.structure.round;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeightRange {
    private long lowestKnownHeight;
    private long highestKnownHeight;
}
