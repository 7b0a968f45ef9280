/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.ops.serde;

/**
 * @hidden
 */
public interface SerializerFactory {

    Serializer createFindSerializer();

    Serializer createFindOneSerializer();

    Serializer createInsertOneSerializer();

    Serializer createInsertManySerializer();

    Serializer createUpdateSerializer();

    Serializer createDeleteSerializer();

    Serializer createCountDocumentsSerializer();

    Serializer createFindOneAndUpdateSerializer();

    Serializer createFindOneAndReplaceSerializer();

    Serializer createFindOneAndDeleteSerializer();
}
