/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON read-interface for an entity.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {

  
  /**
   * Returns the given JSON as the typed instance.
   * 
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  /**
   * Returns the given JSON input as a typed entity.
   * Invokes {@linkplain #toEntity(JSONObject)} after constructing a {@code JSONObject}
   * using the {@code json.simple} library.
   * 
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object
   */
  default T toEntity(String json) throws JsonParsingException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(json);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + abbreviate(json), px);
    }
    if (parsed instanceof JSONObject jObj)
      return toEntity(jObj);
    throw new JsonParsingException("not a JSON object: " + abbreviate(json));
  }
  
  
  private static String abbreviate(String json) {
    return json.length() <= 40 ? json : json.substring(0, 40) + "...";
  }
  

  /**
   * Returns the given JSON input as a typed entity.
   * 
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object
   * 
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(reader);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json", px);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
    if (parsed instanceof JSONObject jObj)
      return toEntity(jObj);
    throw new JsonParsingException("not a JSON object");
  }
  
  
  /**
   * Reads the given UTF-8 JSON file.
   */
  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }
  
  /**
   * Returns the given JSON array as a typed list.
   * 
   * @param jArray null counts as empty
   * 
   * @return read-only, possibly empty list
   */
  default List<T> toEntityList(JSONArray jArray) throws JsonParsingException {
    int size = jArray == null ? 0 : jArray.size();
    if (size == 0)
      return Collections.emptyList();
    
    ArrayList<T> list = new ArrayList<>(size);
    for (int index = 0; index < size; ++index) {
      if (!(jArray.get(index) instanceof JSONObject jObj))
        throw new JsonParsingException(
            "expected JSON object at [" + index + "]: " + jArray.get(index));
      list.add(toEntity(jObj));
    }
    return Collections.unmodifiableList(list);
  }
  
}
