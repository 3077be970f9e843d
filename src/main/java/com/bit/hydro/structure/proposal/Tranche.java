package com.bit.hydro.structure.proposal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Tranche {
    private long id;
    private String name;
    private String metadata;
}
