package com.nan.shortsvc.model;

/*
  Body of POST /api: {"v":"<value to shorten>"}
*/
public class CreateRequest {
    private String v;

    // Default constructor required by Jackson
    public CreateRequest() {}

    public CreateRequest(String v) {
        this.v = v;
    }

    public String getV() { return v; }

    public void setV(String v) { this.v = v; }
}
