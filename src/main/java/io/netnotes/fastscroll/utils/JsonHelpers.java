package io.netnotes.fastscroll.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;

public class JsonHelpers {

    /**
     * @return the parsed object, or null if the text is null, malformed or not a JSON object
     */
    public static JsonObject parseObject(String json){
        if(json == null){
            return null;
        }
        try{
            JsonElement element = JsonParser.parseString(json);
            return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
        }catch(JsonParseException e){
            Log.logError("JsonHelpers.parseObject", e);
            return null;
        }
    }

    /**
     * Reads a JSON object from a classpath resource.
     *
     * @return the object, or null if the resource is missing or not a JSON object
     */
    public static JsonObject readResource(Class<?> owner, String resourceName){
        try(InputStream in = owner.getResourceAsStream(resourceName)){
            if(in == null){
                return null;
            }
            try(Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)){
                JsonElement element = JsonParser.parseReader(reader);
                return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
            }
        }catch(IOException | JsonParseException e){
            Log.logError("JsonHelpers.readResource: " + resourceName, e);
            return null;
        }
    }

    public static JsonObject getJsonObject(JsonObject json, String name){
        JsonElement element = json != null ? json.get(name) : null;
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    public static String getString(JsonObject json, String name, String defaultValue){
        JsonElement element = json != null ? json.get(name) : null;
        return element != null && !element.isJsonNull() && element.isJsonPrimitive() ? element.getAsString() : defaultValue;
    }

    public static int getInt(JsonObject json, String name, int defaultValue){
        JsonElement element = json != null ? json.get(name) : null;
        if(element == null || element.isJsonNull() || !element.isJsonPrimitive()){
            return defaultValue;
        }
        try{
            return element.getAsInt();
        }catch(NumberFormatException e){
            Log.logError("JsonHelpers.getInt: " + name, e);
            return defaultValue;
        }
    }

    public static float getFloat(JsonObject json, String name, float defaultValue){
        JsonElement element = json != null ? json.get(name) : null;
        if(element == null || element.isJsonNull() || !element.isJsonPrimitive()){
            return defaultValue;
        }
        try{
            return element.getAsFloat();
        }catch(NumberFormatException e){
            Log.logError("JsonHelpers.getFloat: " + name, e);
            return defaultValue;
        }
    }

    public static boolean getBoolean(JsonObject json, String name, boolean defaultValue){
        JsonElement element = json != null ? json.get(name) : null;
        return element != null && !element.isJsonNull() && element.isJsonPrimitive() ? element.getAsBoolean() : defaultValue;
    }
}
