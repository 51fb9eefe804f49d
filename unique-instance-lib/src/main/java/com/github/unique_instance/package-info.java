// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Single instance coordination for command line applications.
///
/// The first launch of an application becomes the leader and runs commands. Every later launch by the
/// same user forwards its arguments and stdin to the leader over a loopback socket and exits with the
/// result code and output the leader sends back.
///
/// The host application provides:
/// 1. An application id, which names the lock file in the user home (see [com.github.unique_instance.LockFile]).
/// 2. A [com.github.unique_instance.CommandHandler] executing a command given its arguments and stdin.
/// 3. A ready signal telling when the leader may start executing commands.
///
/// Supporting classes:
/// - [com.github.unique_instance.LockCoordinator]: elects the leader using two byte-range locks of the lock file.
/// - [com.github.unique_instance.LeaderListener]: publishes the listener port and accepts followers.
/// - [com.github.unique_instance.ConnectionHandler]: executes one follower request.
/// - [com.github.unique_instance.FollowerForwarder]: sends the request of a follower and streams its stdin.
/// - [com.github.unique_instance.ProtocolPickle]: the binary encoding of requests and results.
/// - [com.github.unique_instance.LeaderLifecycle]: cleans up the lock file when the leader goes away.
package com.github.unique_instance;
