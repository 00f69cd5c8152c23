package stac.adapter.in.rest;

import io.restassured.RestAssured;
import io.restassured.parsing.Parser;

import stac.core.model.common.MediaTypes;

/**
 * Registers JSON parsing for the GeoJSON, JSON Schema and problem media types served by the API.
 */
final class StacRestAssured {

    private StacRestAssured() {}

    static void registerParsers() {
        RestAssured.registerParser(MediaTypes.GEOJSON, Parser.JSON);
        RestAssured.registerParser(MediaTypes.JSON_SCHEMA, Parser.JSON);
        RestAssured.registerParser("application/problem+json", Parser.JSON);
    }
}
