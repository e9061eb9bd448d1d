package com.nan.shortsvc.model;

/*
  Error body shared by every failing endpoint.
  - error: human readable message
  - code: stable identifier clients can switch on
*/
public class ErrorResponse {
    private String error;
    private String code;

    public ErrorResponse() {}

    public ErrorResponse(String error, String code) {
        this.error = error;
        this.code = code;
    }

    public String getError() { return error; }
    public String getCode() { return code; }

    public void setError(String error) { this.error = error; }
    public void setCode(String code) { this.code = code; }
}
