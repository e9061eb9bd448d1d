package com.nan.shortsvc.model;

// {"v":"<value>"}
public class LookupResponse {
    private String v;

    public LookupResponse() {}

    public LookupResponse(String v) {
        this.v = v;
    }

    public String getV() { return v; }

    public void setV(String v) { this.v = v; }
}
