package io.leanweb.server.core;

/**
 * Wire-level response body.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    int length();

    record Empty() implements ResponseBody {
        @Override
        public int length() {
            return 0;
        }
    }

    record Bytes(byte[] bytes) implements ResponseBody {
        @Override
        public int length() {
            return bytes.length;
        }
    }
}
