package com.valkyrlabs.thordrive.security;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.NodeKind;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

@ExtendWith(MockitoExtension.class)
class DrivePermissionEvaluatorTest {

  @Mock
  private AccessResolver accessResolver;

  private DrivePermissionEvaluator sut;
  private Authentication alice;

  @BeforeEach
  void setUp() {
    sut = new DrivePermissionEvaluator(accessResolver);
    alice = new UsernamePasswordAuthenticationToken("alice", "n/a",
        List.of(new SimpleGrantedAuthority("ROLE_USER")));
  }

  @Nested
  class ById {

    @Test
    void hasPermission_whenResolverGrants_returnsTrue() {
      when(accessResolver.canAccess("alice", "file-1", NodeKind.FILE)).thenReturn(true);

      assertTrue(sut.hasPermission(alice, "file-1", "FILE", "READ"));
    }

    @Test
    void hasPermission_whenResolverDenies_returnsFalse() {
      when(accessResolver.canAccess("alice", "folder-1", NodeKind.FOLDER)).thenReturn(false);

      assertFalse(sut.hasPermission(alice, "folder-1", "FOLDER", "SHARE"));
    }

    @Test
    void hasPermission_acceptsEntityClassNamesAsTargetType() {
      when(accessResolver.canAccess("alice", "folder-1", NodeKind.FOLDER)).thenReturn(true);

      assertTrue(sut.hasPermission(alice, "folder-1", DriveFolder.class.getName(), "move"));
    }

    @Test
    void hasPermission_whenNodeMissing_returnsFalse() {
      when(accessResolver.canAccess("alice", "gone", NodeKind.FILE))
          .thenThrow(new NodeNotFoundException(NodeKind.FILE, "gone"));

      assertFalse(sut.hasPermission(alice, "gone", "file", "READ"));
    }

    @Test
    void hasPermission_unknownPermission_deniesWithoutLookup() {
      assertFalse(sut.hasPermission(alice, "file-1", "FILE", "DELETE"));
      verifyNoInteractions(accessResolver);
    }

    @Test
    void hasPermission_unknownTargetType_deniesWithoutLookup() {
      assertFalse(sut.hasPermission(alice, "x", "Invoice", "READ"));
      verifyNoInteractions(accessResolver);
    }

    @Test
    void hasPermission_nullArguments_deny() {
      assertFalse(sut.hasPermission(null, "file-1", "FILE", "READ"));
      assertFalse(sut.hasPermission(alice, null, "FILE", "READ"));
      assertFalse(sut.hasPermission(alice, "file-1", "FILE", null));
      verifyNoInteractions(accessResolver);
    }
  }

  @Nested
  class ByDomainObject {

    @Test
    void hasPermission_onFile_usesItsId() {
      Authentication bob = new TestingAuthenticationToken("bob", "n/a");
      DriveFile file = new DriveFile("file-2", "notes", null);
      when(accessResolver.canAccess("bob", "file-2", NodeKind.FILE)).thenReturn(true);

      assertTrue(sut.hasPermission(bob, file, "READ"));
      verify(accessResolver).canAccess("bob", "file-2", NodeKind.FILE);
    }

    @Test
    void hasPermission_onFolder_usesItsId() {
      DriveFolder folder = new DriveFolder("folder-2", "docs");
      when(accessResolver.canAccess("alice", "folder-2", NodeKind.FOLDER)).thenReturn(false);

      assertFalse(sut.hasPermission(alice, folder, "SHARE"));
    }

    @Test
    void hasPermission_onUnsupportedObject_denies() {
      assertFalse(sut.hasPermission(alice, "just a string", "READ"));
      assertFalse(sut.hasPermission(alice, null, "READ"));
      verifyNoInteractions(accessResolver);
    }
  }
}
