package com.geoenrich.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Network collaborator of the engine: fetch a URL and return its parsed JSON body
 */
public interface JsonFetcher {

    /**
     * @throws com.geoenrich.exception.NetworkException when no endpoint could be reached
     * @throws com.geoenrich.exception.ResponseParseException when the last body was not JSON
     */
    JsonNode fetchJson(String url);
}
