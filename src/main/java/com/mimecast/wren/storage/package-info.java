/**
 * Mailbox storage.
 *
 * <p>{@link com.mimecast.wren.storage.MailStore} saves messages into Maildir folders,
 * <br>one per recipient, under <i>root/domain/user/INBOX</i>.
 */
package com.mimecast.wren.storage;
