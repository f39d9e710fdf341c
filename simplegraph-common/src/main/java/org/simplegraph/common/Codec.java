package org.simplegraph.common;

import java.util.List;
import java.util.Map;

/**
 * Encoding-agnostic builder and reader of structured values: scalars, lists, and maps with string keys.
 * Decoding methods throw {@link DecodeException} when the encoded value does not have the requested shape.
 */
public interface Codec {

    interface EncodedValue {
    }

    EncodedValue encodeInt(int i);

    EncodedValue encodeLong(long l);

    EncodedValue encodeDouble(double d);

    EncodedValue encodeString(String s);

    EncodedValue encodeList(List<EncodedValue> list);

    // iteration order of the map is kept
    EncodedValue encodeMap(Map<String, EncodedValue> map);

    int decodeInt(EncodedValue encodedValue);

    long decodeLong(EncodedValue encodedValue);

    double decodeDouble(EncodedValue encodedValue);

    String decodeString(EncodedValue encodedValue);

    List<EncodedValue> decodeList(EncodedValue encodedValue);

    Map<String, EncodedValue> decodeMap(EncodedValue encodedValue);
}
