package com.pokerpulse.enrichment.dto;

import java.util.Set;

public class ReResolveRequest {
    public enum Dimension { VENUE, SERIES, RECURRING }

    private Set<Dimension> dimensions;
    private boolean clearManual;

    public Set<Dimension> getDimensions() { return dimensions; }
    public void setDimensions(Set<Dimension> dimensions) { this.dimensions = dimensions; }
    public boolean isClearManual() { return clearManual; }
    public void setClearManual(boolean clearManual) { this.clearManual = clearManual; }
}
