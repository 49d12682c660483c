/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package retlog.decoding;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;
import retlog.interfaces.decoding.Publication;

import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory set of publications, by name. A session captures the publication it starts with, so
 * altering or dropping a publication affects only sessions started afterwards.
 */
public class PublicationCatalog {
  private static final Logger LOG = LoggerFactory.getLogger(PublicationCatalog.class);

  private final ConcurrentMap<String, Publication> publications = new ConcurrentHashMap<>();

  public void create(Publication publication) throws DuplicatePublication {
    if (publications.putIfAbsent(publication.getName(), publication) != null) {
      throw new DuplicatePublication(publication.getName());
    }
    LOG.info("Created {}", publication);
  }

  public void alter(Publication publication) throws PublicationNotFound {
    if (publications.replace(publication.getName(), publication) == null) {
      throw new PublicationNotFound(publication.getName());
    }
    LOG.info("Redefined {}", publication);
  }

  public void drop(String name) throws PublicationNotFound {
    if (publications.remove(name) == null) {
      throw new PublicationNotFound(name);
    }
    LOG.info("Dropped publication {}", name);
  }

  public Publication get(String name) throws PublicationNotFound {
    final Publication publication = publications.get(name);
    if (publication == null) {
      throw new PublicationNotFound(name);
    }
    return publication;
  }

  public ImmutableList<Publication> publications() {
    return ImmutableList.sortedCopyOf(Comparator.comparing(Publication::getName), publications.values());
  }

  public static class DuplicatePublication extends RetentionException {
    public DuplicatePublication(String name) {
      super(ErrorKind.DUPLICATE_PUBLICATION, "publication " + name + " already exists");
    }
  }

  public static class PublicationNotFound extends RetentionException {
    public PublicationNotFound(String name) {
      super(ErrorKind.PUBLICATION_NOT_FOUND, "publication " + name + " does not exist");
    }
  }
}
