package com.excsn.pathstore.core.serializers;

import java.io.IOException;

public interface ValueSerializer<Output> {

  Output serialize(Object value) throws IOException;
}
