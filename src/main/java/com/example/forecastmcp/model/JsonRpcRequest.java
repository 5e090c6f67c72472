package com.example.forecastmcp.model;

import java.util.Map;

public class JsonRpcRequest {
    private String jsonrpc;
    private String method;
    private Map<String, Object> params;
    private Object id;

    public JsonRpcRequest() {
    }

    public JsonRpcRequest(String method, Map<String, Object> params, Object id) {
        this.jsonrpc = "2.0";
        this.method = method;
        this.params = params;
        this.id = id;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public void setJsonrpc(String jsonrpc) {
        this.jsonrpc = jsonrpc;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }

    public Object getId() {
        return id;
    }

    public void setId(Object id) {
        this.id = id;
    }
}
