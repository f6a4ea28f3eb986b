/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;

import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * The JSON entity output interface.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityWriter<T> {
  
  
  /**
   * Returns the given {@code entity} as JSON.
   * 
   * @return {@code injectEntity(entity, new JSONObject())}
   */
  default JSONObject toJsonObject(T entity) {
    return injectEntity(entity, new JSONObject());
  }
  
  
  /**
   * Injects the given {@code entity}'s fields into the
   * given {@code JSONObject}.
   * 
   * @param entity  not null
   * @param jObj    not null
   * 
   * @return the given {@code jObj}
   */
  JSONObject injectEntity(T entity, JSONObject jObj);
  
  
  /**
   * Returns the given list as a JSON array.
   */
  @SuppressWarnings("unchecked")
  default JSONArray toJsonArray(List<T> list) {
    JSONArray jArray = new JSONArray();
    for (T entity : list)
      jArray.add( toJsonObject(entity) );
    return jArray;
  }
  
  
  /**
   * Returns the given entity as a JSON string on a single line.
   */
  default String toJson(T entity) {
    return toJsonObject(entity).toJSONString();
  }

}
