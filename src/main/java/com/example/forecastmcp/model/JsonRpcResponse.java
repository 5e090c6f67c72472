package com.example.forecastmcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"jsonrpc", "result", "error", "id"})
public class JsonRpcResponse {
    private String jsonrpc;
    private Object result;
    private JsonRpcError error;
    private Object id;

    public JsonRpcResponse() {
        this.jsonrpc = "2.0";
    }

    public static JsonRpcResponse success(Object id, Object result) {
        JsonRpcResponse response = new JsonRpcResponse();
        response.setId(id);
        response.setResult(result);
        return response;
    }

    public static JsonRpcResponse failure(Object id, int code, String message) {
        return failure(id, code, message, null);
    }

    public static JsonRpcResponse failure(Object id, int code, String message, Object data) {
        JsonRpcResponse response = new JsonRpcResponse();
        response.setId(id);
        response.setError(new JsonRpcError(code, message, data));
        return response;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public void setJsonrpc(String jsonrpc) {
        this.jsonrpc = jsonrpc;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public JsonRpcError getError() {
        return error;
    }

    public void setError(JsonRpcError error) {
        this.error = error;
    }

    // id is written even when unknown: parse errors answer with "id": null
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Object getId() {
        return id;
    }

    public void setId(Object id) {
        this.id = id;
    }
}
