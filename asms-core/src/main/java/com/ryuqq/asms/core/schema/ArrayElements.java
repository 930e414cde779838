package com.ryuqq.asms.core.schema;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/**
 * 객체 배열과 원시 배열을 원소 리스트로 펼침 (원시 값은 박싱).
 */
final class ArrayElements {

    private ArrayElements() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static List<Object> of(Object array) {
        int length = Array.getLength(array);
        List<Object> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            items.add(Array.get(array, i));
        }
        return items;
    }
}
