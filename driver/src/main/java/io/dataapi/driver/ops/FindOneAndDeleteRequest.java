/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops;

import io.dataapi.driver.ops.serde.Serializer;
import io.dataapi.driver.ops.serde.SerializerFactory;

/**
 * Represents the input to a findOneAndDelete command.
 */
public class FindOneAndDeleteRequest
    extends FindOneAndModifyRequest<FindOneAndDeleteRequest> {

    @Override
    protected FindOneAndDeleteRequest self() {
        return this;
    }

    @Override
    public String getCommandName() {
        return "findOneAndDelete";
    }

    @Override
    public Serializer createSerializer(SerializerFactory factory) {
        return factory.createFindOneAndDeleteSerializer();
    }
}
