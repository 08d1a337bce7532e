package io.arbor.internal_api.json;

import com.google.gson.annotations.SerializedName;

/** One transition clause of a property sheet description. */
public final class PropertyTransitionJson {
  @SerializedName("type")
  public String kind;

  public Boolean named;

  public Integer index;

  public String field;

  public String text;

  @SerializedName("state_id")
  public Integer stateId;
}
