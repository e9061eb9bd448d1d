package com.nan.shortsvc.model;

// {"k":"<key>"}
public class CreateResponse {
    private String k;

    public CreateResponse() {}

    public CreateResponse(String k) {
        this.k = k;
    }

    public String getK() { return k; }

    public void setK(String k) { this.k = k; }
}
